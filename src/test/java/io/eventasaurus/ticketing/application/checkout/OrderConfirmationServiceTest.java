package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderConfirmedEvent;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.domain.order.OrderStatus;
import io.eventasaurus.ticketing.infrastructure.metrics.MetricsCollector;
import io.eventasaurus.ticketing.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OrderConfirmationServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private MetricsCollector metricsCollector;

    private OrderConfirmationService confirmationService;

    @BeforeEach
    void setUp() {
        confirmationService = new OrderConfirmationService(
            orderRepository, eventPublisher, metricsCollector, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("PENDING 주문 확정 - 조건부 UPDATE 1건이면 전이 + 이벤트 발행")
    void confirm_전이성공() {
        // Given
        Order order = TestFixtures.pendingOrderWithReference(1L, 100L, "pi_1");
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        given(orderRepository.confirmIfPending(1L, now, "evt_1")).willReturn(1);

        // When
        ConfirmationResult result = confirmationService.confirm(order, "evt_1", ConfirmationSource.WEBHOOK);

        // Then
        assertThat(result.transitioned()).isTrue();
        assertThat(result.status()).isEqualTo(OrderStatus.CONFIRMED);

        ArgumentCaptor<OrderConfirmedEvent> captor = ArgumentCaptor.forClass(OrderConfirmedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().orderId()).isEqualTo(1L);
        assertThat(captor.getValue().confirmationEventId()).isEqualTo("evt_1");
        assertThat(captor.getValue().confirmedAt()).isEqualTo(now);
        verify(metricsCollector).recordConfirmation("webhook");
    }

    @Test
    @DisplayName("동시 호출에서 진 쪽 - UPDATE 0건이면 전이 없음, 이벤트 없음")
    void confirm_경쟁패배_변경없음() {
        // Given: 메모리상 PENDING 이지만 DB 에서는 이미 다른 호출이 확정
        Order order = TestFixtures.pendingOrderWithReference(1L, 100L, "pi_1");
        given(orderRepository.confirmIfPending(eq(1L), any(LocalDateTime.class), eq("sync_x"))).willReturn(0);

        // When
        ConfirmationResult result = confirmationService.confirm(order, "sync_x", ConfirmationSource.SYNC);

        // Then
        assertThat(result.transitioned()).isFalse();
        assertThat(result.status()).isEqualTo(OrderStatus.CONFIRMED);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
        verifyNoInteractions(metricsCollector);
    }

    @Test
    @DisplayName("이미 CONFIRMED 인 주문 - UPDATE 시도 없이 no-op")
    void confirm_이미확정_noop() {
        Order order = TestFixtures.confirmedOrder(1L, 100L);

        ConfirmationResult result = confirmationService.confirm(order, "evt_dup", ConfirmationSource.WEBHOOK);

        assertThat(result.transitioned()).isFalse();
        verify(orderRepository, never()).confirmIfPending(anyLong(), any(), anyString());
        verifyNoInteractions(eventPublisher);
    }
}

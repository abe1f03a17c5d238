package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.event.EventRepository;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import io.eventasaurus.ticketing.domain.ticket.TicketRepository;
import io.eventasaurus.ticketing.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CheckoutTransactionServiceTest {

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private EventRepository eventRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private InventoryGuard inventoryGuard;

    private CheckoutTransactionService transactionService;

    @BeforeEach
    void setUp() {
        transactionService = new CheckoutTransactionService(
            ticketRepository, eventRepository, orderRepository, inventoryGuard,
            TestFixtures.paymentProperties(), Clock.systemUTC());
    }

    @Test
    @DisplayName("PENDING 주문 생성 - 잠금 조회, 재고 검증, 수수료 5% 계산")
    void createPendingOrder_성공() {
        // Given
        Ticket ticket = TestFixtures.fixedTicket(1L, 2_500L, 100);
        given(ticketRepository.findByIdWithLockOrThrow(1L)).willReturn(ticket);
        given(eventRepository.findByIdOrThrow(ticket.getEventId())).willReturn(TestFixtures.event(10L, "acct_1"));
        given(inventoryGuard.checkAndReserve(ticket, 2)).willReturn(98L);
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));

        // When
        PendingCheckout pending = transactionService.createPendingOrder(100L, 1L, 2, null, null);

        // Then
        Order order = pending.order();
        assertThat(order.getTotalCents()).isEqualTo(5_000L);
        assertThat(order.getApplicationFeeCents()).isEqualTo(250L);
        assertThat(order.getUserId()).isEqualTo(100L);
        assertThat(pending.payoutAccountId()).isEqualTo("acct_1");
        assertThat(pending.ticketTitle()).isEqualTo("General Admission");
    }

    @Test
    @DisplayName("티켓 없음 - TICKET_NOT_FOUND")
    void createPendingOrder_티켓없음_예외발생() {
        given(ticketRepository.findByIdWithLockOrThrow(99L))
            .willThrow(new BusinessException(ErrorCode.TICKET_NOT_FOUND));

        assertThatThrownBy(() -> transactionService.createPendingOrder(100L, 99L, 1, null, null))
            .isInstanceOf(BusinessException.class)
            .hasMessage("Ticket not found");
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("주최자 결제 계정 미연동 - PAYMENT_ACCOUNT_NOT_CONNECTED, 주문 없음")
    void createPendingOrder_결제계정없음_예외발생() {
        Ticket ticket = TestFixtures.fixedTicket(1L, 2_500L, 100);
        given(ticketRepository.findByIdWithLockOrThrow(1L)).willReturn(ticket);
        given(eventRepository.findByIdOrThrow(ticket.getEventId())).willReturn(TestFixtures.event(10L, null));

        assertThatThrownBy(() -> transactionService.createPendingOrder(100L, 1L, 1, null, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PAYMENT_ACCOUNT_NOT_CONNECTED);
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("자율가 최소 금액 미만 - 재고 검증/INSERT 전에 거절")
    void createPendingOrder_최소금액미만_주문없음() {
        // Given: base 2000, minimum 1000, custom 500
        Ticket ticket = Ticket.flexible(10L, "PWYW", 2_000L, 1_000L, null, 100, false);
        given(ticketRepository.findByIdWithLockOrThrow(1L)).willReturn(ticket);
        given(eventRepository.findByIdOrThrow(10L)).willReturn(TestFixtures.event(10L, "acct_1"));

        // When & Then
        assertThatThrownBy(() -> transactionService.createPendingOrder(100L, 1L, 1, 500L, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_BELOW_MINIMUM);
        verify(inventoryGuard, never()).checkAndReserve(any(), anyInt());
        verify(orderRepository, never()).save(any());
    }

    @Test
    @DisplayName("재고 부족 - INSERT 없음")
    void createPendingOrder_재고부족_주문없음() {
        Ticket ticket = TestFixtures.fixedTicket(1L, 2_500L, 2);
        given(ticketRepository.findByIdWithLockOrThrow(1L)).willReturn(ticket);
        given(eventRepository.findByIdOrThrow(ticket.getEventId())).willReturn(TestFixtures.event(10L, "acct_1"));
        given(inventoryGuard.checkAndReserve(ticket, 5)).willThrow(new BusinessException(ErrorCode.TICKET_SOLD_OUT));

        assertThatThrownBy(() -> transactionService.createPendingOrder(100L, 1L, 5, null, null))
            .isInstanceOf(BusinessException.class)
            .hasMessage("Ticket is no longer available");
        verify(orderRepository, never()).save(any());
    }
}

package io.eventasaurus.ticketing.domain.ticket;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class TicketTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 5, 1, 12, 0);

    @Test
    @DisplayName("판매 기간 미설정이면 항상 판매 중")
    void isOnSaleAt_기간없음() {
        Ticket ticket = Ticket.fixed(1L, "GA", 1_000L, 10, false);

        assertThat(ticket.isOnSaleAt(NOW)).isTrue();
    }

    @Test
    @DisplayName("판매 기간 경계는 포함")
    void isOnSaleAt_경계포함() {
        Ticket ticket = Ticket.fixed(1L, "GA", 1_000L, 10, false);
        ticket.changeSaleWindow(NOW, NOW.plusDays(1));

        assertThat(ticket.isOnSaleAt(NOW)).isTrue();
        assertThat(ticket.isOnSaleAt(NOW.plusDays(1))).isTrue();
        assertThat(ticket.isOnSaleAt(NOW.minusSeconds(1))).isFalse();
        assertThat(ticket.isOnSaleAt(NOW.plusDays(1).plusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("종료가 시작보다 앞서면 예외")
    void changeSaleWindow_역전_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 1_000L, 10, false);

        assertThatThrownBy(() -> ticket.changeSaleWindow(NOW, NOW.minusHours(1)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("자율가 티켓은 최소 금액이 음수일 수 없다")
    void flexible_최소금액음수_예외발생() {
        assertThatThrownBy(() -> Ticket.flexible(1L, "PWYW", 1_000L, -1L, null, 10, false))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }
}

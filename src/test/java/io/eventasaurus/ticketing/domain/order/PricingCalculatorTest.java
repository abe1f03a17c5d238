package io.eventasaurus.ticketing.domain.order;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.ticket.PricingModel;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class PricingCalculatorTest {

    @Test
    @DisplayName("고정가 - 단가 x 수량, 팁 없음")
    void fixed_기본가격_성공() {
        // Given
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, false);

        // When
        PriceQuote quote = PricingCalculator.calculate(ticket, 2, null, null);

        // Then
        assertThat(quote.unitPriceCents()).isEqualTo(2_500L);
        assertThat(quote.subtotalCents()).isEqualTo(5_000L);
        assertThat(quote.tipCents()).isZero();
        assertThat(quote.totalCents()).isEqualTo(5_000L);
        assertThat(quote.snapshot().getPricingModel()).isEqualTo(PricingModel.FIXED);
        assertThat(quote.snapshot().getCustomPriceCents()).isNull();
    }

    @Test
    @DisplayName("고정가 - custom price 지정 시 거절")
    void fixed_customPrice_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, false);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, 100L, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CUSTOM_PRICE_NOT_ALLOWED);
    }

    @Test
    @DisplayName("자율가 - 최소 금액 미만이면 PRICE_BELOW_MINIMUM")
    void flexible_최소금액미만_예외발생() {
        // Given: base 2000, minimum 1000
        Ticket ticket = Ticket.flexible(1L, "PWYW", 2_000L, 1_000L, null, 100, false);

        // When & Then
        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, 500L, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRICE_BELOW_MINIMUM)
            .hasMessage("Price is below minimum required amount");
    }

    @Test
    @DisplayName("자율가 - 최소 금액과 같으면 허용, 스냅샷에 custom/minimum 기록")
    void flexible_최소금액_성공() {
        Ticket ticket = Ticket.flexible(1L, "PWYW", 2_000L, 1_000L, 2_500L, 100, false);

        PriceQuote quote = PricingCalculator.calculate(ticket, 3, 1_000L, null);

        assertThat(quote.unitPriceCents()).isEqualTo(1_000L);
        assertThat(quote.subtotalCents()).isEqualTo(3_000L);
        assertThat(quote.snapshot().getCustomPriceCents()).isEqualTo(1_000L);
        assertThat(quote.snapshot().getMinimumPriceCents()).isEqualTo(1_000L);
        assertThat(quote.snapshot().getSuggestedPriceCents()).isEqualTo(2_500L);
        assertThat(quote.snapshot().getBasePriceCents()).isEqualTo(2_000L);
    }

    @Test
    @DisplayName("자율가 - custom price 미지정 시 CUSTOM_PRICE_REQUIRED")
    void flexible_customPrice누락_예외발생() {
        Ticket ticket = Ticket.flexible(1L, "PWYW", 2_000L, 1_000L, null, 100, false);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, null, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CUSTOM_PRICE_REQUIRED);
    }

    @Test
    @DisplayName("팁 - tippable 티켓이면 total 에 합산")
    void tip_허용티켓_합산() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, true);

        PriceQuote quote = PricingCalculator.calculate(ticket, 2, null, 300L);

        assertThat(quote.subtotalCents()).isEqualTo(5_000L);
        assertThat(quote.tipCents()).isEqualTo(300L);
        assertThat(quote.totalCents()).isEqualTo(5_300L);
        assertThat(quote.snapshot().isTicketTippable()).isTrue();
    }

    @Test
    @DisplayName("팁 - tippable 아닌 티켓에 팁을 주면 TIP_NOT_ALLOWED")
    void tip_비허용티켓_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, false);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, null, 100L))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TIP_NOT_ALLOWED);
    }

    @Test
    @DisplayName("팁 - 0 은 팁 없음으로 취급 (tippable 아니어도 허용)")
    void tip_0_허용() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, false);

        PriceQuote quote = PricingCalculator.calculate(ticket, 1, null, 0L);

        assertThat(quote.tipCents()).isZero();
        assertThat(quote.totalCents()).isEqualTo(2_500L);
    }

    @Test
    @DisplayName("팁 - 음수는 INVALID_INPUT")
    void tip_음수_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, true);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, null, -1L))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("수량 0 이하는 INVALID_QUANTITY")
    void quantity_0_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, false);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 0, null, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_QUANTITY);
    }

    @Test
    @DisplayName("자율가 - 단가 x 수량이 long 범위를 넘으면 ArithmeticException 이 아닌 INVALID_INPUT")
    void flexible_금액오버플로_예외발생() {
        // Given
        Ticket ticket = Ticket.flexible(1L, "PWYW", 2_000L, 1_000L, null, 100, false);

        // When & Then
        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 3, Long.MAX_VALUE / 2, null))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT)
            .hasMessage("Order total exceeds the maximum chargeable amount");
    }

    @Test
    @DisplayName("팁 - subtotal + tip 이 long 범위를 넘으면 INVALID_INPUT")
    void tip_금액오버플로_예외발생() {
        Ticket ticket = Ticket.fixed(1L, "GA", 2_500L, 100, true);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, null, Long.MAX_VALUE))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("total 이 청구 가능 최대 금액을 넘으면 INVALID_INPUT, 같으면 허용")
    void total_최대금액_경계() {
        Ticket ticket = Ticket.flexible(1L, "PWYW", 2_000L, 1_000L, null, 100, true);

        PriceQuote atLimit = PricingCalculator.calculate(ticket, 1, PricingCalculator.MAX_TOTAL_CENTS - 1, 1L);
        assertThat(atLimit.totalCents()).isEqualTo(PricingCalculator.MAX_TOTAL_CENTS);

        assertThatThrownBy(() -> PricingCalculator.calculate(ticket, 1, PricingCalculator.MAX_TOTAL_CENTS, 1L))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @ParameterizedTest(name = "unit={0}, quantity={1}, tip={2}")
    @CsvSource({
        "0, 1, 0",
        "1, 10, 0",
        "1999, 7, 150",
        "2500, 3, 1"
    })
    @DisplayName("total = subtotal + tip, subtotal = unit x quantity")
    void 가격불변식(long unit, int quantity, long tip) {
        Ticket ticket = Ticket.fixed(1L, "GA", unit, 100, true);

        PriceQuote quote = PricingCalculator.calculate(ticket, quantity, null, tip);

        assertThat(quote.subtotalCents()).isEqualTo(quote.unitPriceCents() * quantity);
        assertThat(quote.totalCents()).isEqualTo(quote.subtotalCents() + quote.tipCents());
    }
}

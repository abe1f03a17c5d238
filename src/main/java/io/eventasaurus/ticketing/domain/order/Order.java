package io.eventasaurus.ticketing.domain.order;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.common.BaseTimeEntity;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Order Entity
 * <p>
 * status / confirmed_at 은 엔티티 메서드로 바꾸지 않는다.
 * 유일한 쓰기 경로는 OrderRepository.confirmIfPending (조건부 UPDATE) 이며
 * OrderConfirmationService 만 호출한다.
 * <p>
 * payment_reference / stripe_session_id 도 동시 웹훅과 덮어쓰기 경쟁이 없도록
 * 조건부 UPDATE 로만 붙인다.
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_order_ticket_status", columnList = "ticket_id, status"),
        @Index(name = "idx_order_user", columnList = "user_id"),
        @Index(name = "idx_order_payment_reference", columnList = "payment_reference"),
        @Index(name = "idx_order_session", columnList = "stripe_session_id")
    }
)
@Getter
@NoArgsConstructor
public class Order extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private Long ticketId;

    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Embedded
    private PricingSnapshot pricingSnapshot;

    @Column(name = "subtotal_cents", nullable = false, updatable = false)
    private Long subtotalCents;

    @Column(name = "total_cents", nullable = false, updatable = false)
    private Long totalCents;

    @Column(name = "application_fee_cents", nullable = false, updatable = false)
    private Long applicationFeeCents;  // 플랫폼 수수료

    @Column(nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;   // payment intent id (pi_...)

    @Column(name = "stripe_session_id", length = 100)
    private String stripeSessionId;    // checkout session id (cs_...)

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "confirmation_event_id", length = 100)
    private String confirmationEventId;  // 확정을 일으킨 웹훅 이벤트 id 또는 sync_...

    public static Order create(Long userId, Ticket ticket, PriceQuote quote, long applicationFeeCents) {
        validateUserId(userId);
        validateQuote(quote);
        if (applicationFeeCents < 0 || applicationFeeCents > quote.totalCents()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Application fee must be between 0 and the order total");
        }

        Order order = new Order();
        order.userId = userId;
        order.ticketId = ticket.getId();
        order.eventId = ticket.getEventId();
        order.quantity = quote.quantity();
        order.status = OrderStatus.PENDING;
        order.pricingSnapshot = quote.snapshot();
        order.subtotalCents = quote.subtotalCents();
        order.totalCents = quote.totalCents();
        order.applicationFeeCents = applicationFeeCents;
        order.currency = ticket.getCurrency();
        order.paymentReference = null;  // 세션 생성 후 부착
        order.stripeSessionId = null;
        order.confirmedAt = null;
        return order;
    }

    public boolean isPending() {
        return this.status == OrderStatus.PENDING;
    }

    public boolean isConfirmed() {
        return this.status == OrderStatus.CONFIRMED;
    }

    public boolean isOwnedBy(Long userId) {
        return this.userId.equals(userId);
    }

    public boolean hasPaymentReference() {
        return paymentReference != null && !paymentReference.isBlank();
    }

    public boolean hasCheckoutSession() {
        return stripeSessionId != null && !stripeSessionId.isBlank();
    }

    public Long getTipCents() {
        return pricingSnapshot.getTipCents();
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateUserId(Long userId) {
        if (userId == null) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED);
        }
    }

    private static void validateQuote(PriceQuote quote) {
        long expectedSubtotal = quote.unitPriceCents() * quote.quantity();
        if (quote.subtotalCents() != expectedSubtotal
            || quote.totalCents() != quote.subtotalCents() + quote.tipCents()) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("Inconsistent price quote: unit=%d, quantity=%d, subtotal=%d, tip=%d, total=%d",
                    quote.unitPriceCents(), quote.quantity(), quote.subtotalCents(), quote.tipCents(), quote.totalCents())
            );
        }
    }
}

package io.eventasaurus.ticketing.domain.ticket;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ticket Entity (티켓 종류)
 * <p>
 * 판매 가능 수량(quantity)은 총량이며, 남은 수량은 저장하지 않는다.
 * 남은 수량 = quantity - (PENDING + CONFIRMED 주문 수량 합) 으로 매번 계산한다.
 * <p>
 * 동시 체크아웃은 이 row에 대한 SELECT FOR UPDATE 로 직렬화된다
 * (TicketRepository.findByIdWithLock).
 */
@Entity
@Table(
    name = "tickets",
    indexes = {
        @Index(name = "idx_ticket_event", columnList = "event_id")
    }
)
@Getter
@NoArgsConstructor
public class Ticket extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(nullable = false, length = 200)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_model", nullable = false, length = 20)
    private PricingModel pricingModel;

    @Column(name = "base_price_cents", nullable = false)
    private Long basePriceCents;

    @Column(name = "minimum_price_cents", nullable = false)
    private Long minimumPriceCents;

    @Column(name = "suggested_price_cents")
    private Long suggestedPriceCents;

    @Column(nullable = false)
    private boolean tippable;

    @Column(nullable = false)
    private Integer quantity;  // 총 판매 수량

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "starts_at")
    private LocalDateTime startsAt;  // null: 즉시 판매

    @Column(name = "ends_at")
    private LocalDateTime endsAt;    // null: 종료 없음

    public static Ticket fixed(Long eventId, String title, Long basePriceCents, Integer quantity, boolean tippable) {
        validateBase(eventId, title, basePriceCents, quantity);

        Ticket ticket = new Ticket();
        ticket.eventId = eventId;
        ticket.title = title;
        ticket.pricingModel = PricingModel.FIXED;
        ticket.basePriceCents = basePriceCents;
        ticket.minimumPriceCents = basePriceCents;
        ticket.suggestedPriceCents = null;
        ticket.tippable = tippable;
        ticket.quantity = quantity;
        ticket.currency = "usd";
        return ticket;
    }

    public static Ticket flexible(Long eventId, String title, Long basePriceCents, Long minimumPriceCents,
                                  Long suggestedPriceCents, Integer quantity, boolean tippable) {
        validateBase(eventId, title, basePriceCents, quantity);
        if (minimumPriceCents == null || minimumPriceCents < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Minimum price must be zero or greater");
        }

        Ticket ticket = new Ticket();
        ticket.eventId = eventId;
        ticket.title = title;
        ticket.pricingModel = PricingModel.FLEXIBLE;
        ticket.basePriceCents = basePriceCents;
        ticket.minimumPriceCents = minimumPriceCents;
        ticket.suggestedPriceCents = suggestedPriceCents;
        ticket.tippable = tippable;
        ticket.quantity = quantity;
        ticket.currency = "usd";
        return ticket;
    }

    /**
     * 판매 기간 설정 (양 끝 포함, null 은 제한 없음)
     */
    public void changeSaleWindow(LocalDateTime startsAt, LocalDateTime endsAt) {
        if (startsAt != null && endsAt != null && endsAt.isBefore(startsAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Sale window end must not precede its start");
        }
        this.startsAt = startsAt;
        this.endsAt = endsAt;
    }

    public boolean isOnSaleAt(LocalDateTime now) {
        if (startsAt != null && now.isBefore(startsAt)) {
            return false;
        }
        return endsAt == null || !now.isAfter(endsAt);
    }

    public boolean isFlexible() {
        return pricingModel == PricingModel.FLEXIBLE;
    }

    private static void validateBase(Long eventId, String title, Long basePriceCents, Integer quantity) {
        if (eventId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event is required");
        }
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ticket title is required");
        }
        if (basePriceCents == null || basePriceCents < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Base price must be zero or greater");
        }
        if (quantity == null || quantity < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ticket quantity must be zero or greater");
        }
    }
}

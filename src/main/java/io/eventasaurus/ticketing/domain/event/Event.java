package io.eventasaurus.ticketing.domain.event;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Event Entity
 *
 * 이벤트 카탈로그는 이 서비스 밖에서 관리된다. 체크아웃에 필요한 필드
 * (제목, 주최자의 결제 연동 계정)만 매핑한다.
 */
@Entity
@Table(name = "events")
@Getter
@NoArgsConstructor
public class Event extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(name = "organizer_id", nullable = false)
    private Long organizerId;

    @Column(name = "payout_account_id", length = 100)
    private String payoutAccountId;  // 주최자 Connect 계정 (acct_...), 미연동 시 null

    public static Event create(String title, Long organizerId, String payoutAccountId) {
        if (title == null || title.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Event title is required");
        }
        if (organizerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Organizer is required");
        }

        Event event = new Event();
        event.title = title;
        event.organizerId = organizerId;
        event.payoutAccountId = payoutAccountId;
        return event;
    }

    public boolean hasPayoutAccount() {
        return payoutAccountId != null && !payoutAccountId.isBlank();
    }
}

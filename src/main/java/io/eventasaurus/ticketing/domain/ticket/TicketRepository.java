package io.eventasaurus.ticketing.domain.ticket;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;

import java.util.Optional;

public interface TicketRepository {

    Optional<Ticket> findById(Long id);

    /**
     * SELECT ... FOR UPDATE
     * 재고 확인과 주문 INSERT 를 한 트랜잭션으로 묶기 위해 사용
     */
    Optional<Ticket> findByIdWithLock(Long id);

    Ticket save(Ticket ticket);

    default Ticket findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
    }

    default Ticket findByIdWithLockOrThrow(Long id) {
        return findByIdWithLock(id)
            .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
    }
}

package io.eventasaurus.ticketing.domain.event;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;

import java.util.Optional;

public interface EventRepository {

    Optional<Event> findById(Long id);

    Event save(Event event);

    long count();

    default Event findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
    }
}

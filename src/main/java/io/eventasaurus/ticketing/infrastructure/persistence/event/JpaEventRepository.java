package io.eventasaurus.ticketing.infrastructure.persistence.event;

import io.eventasaurus.ticketing.domain.event.Event;
import io.eventasaurus.ticketing.domain.event.EventRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaEventRepository extends JpaRepository<Event, Long>, EventRepository {

    @Override
    Optional<Event> findById(Long id);

    @Override
    Event save(Event event);
}

package io.eventasaurus.ticketing.infrastructure.persistence.ticket;

import io.eventasaurus.ticketing.domain.ticket.Ticket;
import io.eventasaurus.ticketing.domain.ticket.TicketRepository;
import jakarta.persistence.LockModeType;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaTicketRepository extends JpaRepository<Ticket, Long>, TicketRepository {

    @Override
    Optional<Ticket> findById(Long id);

    @Override
    Ticket save(Ticket ticket);

    /**
     * Pessimistic Write Lock (SELECT FOR UPDATE)
     * - 같은 티켓에 대한 체크아웃을 직렬화한다
     * - 잠금은 주문 INSERT 가 커밋될 때까지 유지된다
     */
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.id = :id")
    Optional<Ticket> findByIdWithLock(@Param("id") Long id);
}

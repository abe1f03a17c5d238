package io.eventasaurus.ticketing.infrastructure.config;

import io.eventasaurus.ticketing.domain.event.Event;
import io.eventasaurus.ticketing.domain.event.EventRepository;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import io.eventasaurus.ticketing.domain.ticket.TicketRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * local 프로파일 시드 데이터
 * - 결제 계정이 연동된 이벤트 1건
 * - 고정가 티켓 (팁 허용), 자율가 티켓 (최소 10.00)
 */
@Slf4j
@Component
@Profile("local")
@RequiredArgsConstructor
public class DataInitializer implements ApplicationRunner {

    private final EventRepository eventRepository;
    private final TicketRepository ticketRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (eventRepository.count() > 0) {
            log.info("Seed data already exists. Skipping data initialization.");
            return;
        }

        Event event = eventRepository.save(Event.create("Local Meetup", 1L, "acct_local_organizer"));

        Ticket general = ticketRepository.save(
            Ticket.fixed(event.getId(), "General Admission", 2_500L, 100, true));
        Ticket supporter = ticketRepository.save(
            Ticket.flexible(event.getId(), "Pay What You Want", 2_000L, 1_000L, 2_500L, 50, false));

        log.info("Seed data loaded: eventId={}, fixedTicketId={}, flexibleTicketId={}",
            event.getId(), general.getId(), supporter.getId());
    }
}

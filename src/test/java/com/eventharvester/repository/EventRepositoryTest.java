package com.eventharvester.repository;

import com.eventharvester.model.Event;
import com.eventharvester.model.Venue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class EventRepositoryTest {

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private VenueRepository venueRepository;

    private Event event(String title, String sourceUrl, Instant start) {
        return Event.builder()
                .title(title)
                .city("Wien")
                .venueName("Flex")
                .source("flex-scraper")
                .sourceUrl(sourceUrl)
                .startDateTime(start)
                .build();
    }

    @Test
    void testFindBySourceUrl() {
        Event saved = eventRepository.saveAndFlush(event("Opening", "https://flex.test/e/1",
                Instant.parse("2025-12-05T22:00:00Z")));

        assertEquals(saved.getId(), eventRepository.findFirstBySourceUrl("https://flex.test/e/1").orElseThrow().getId());
        assertNotNull(saved.getCreatedAt());
        assertTrue(eventRepository.findFirstBySourceUrl("https://flex.test/e/2").isEmpty());
    }

    @Test
    void testFindByTitleAndStart() {
        Instant start = Instant.parse("2025-12-12T21:00:00Z");
        eventRepository.saveAndFlush(event("Bass Culture", null, start));

        assertTrue(eventRepository.findFirstByTitleAndStartDateTime("Bass Culture", start).isPresent());
        assertTrue(eventRepository.findFirstByTitleAndStartDateTime("Bass Culture",
                start.plusSeconds(3600)).isEmpty());
    }

    @Test
    void testDatelessEventIsStored() {
        Event saved = eventRepository.saveAndFlush(event("Secret Guest", null, null));

        assertNull(eventRepository.findById(saved.getId()).orElseThrow().getStartDateTime());
    }

    @Test
    void testUnlinkedEvents() {
        Event linked = event("Linked", "https://flex.test/e/3", null);
        linked.setVenueId(1L);
        Event anonymous = event("No venue", "https://flex.test/e/4", null);
        anonymous.setVenueName(null);
        Event unlinked = event("Unlinked", "https://flex.test/e/5", null);
        eventRepository.saveAll(List.of(linked, anonymous, unlinked));

        List<Event> found = eventRepository.findByVenueIdIsNullAndVenueNameIsNotNull();

        assertEquals(1, found.size());
        assertEquals("Unlinked", found.get(0).getTitle());
    }

    @Test
    void testVenueNormalizedNameIsDerived() {
        Venue venue = venueRepository.saveAndFlush(Venue.builder().name("  Grelle   FORELLE ").city("Wien").build());

        assertEquals("grelle forelle", venue.getNormalizedName());
    }
}

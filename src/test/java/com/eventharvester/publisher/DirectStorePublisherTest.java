package com.eventharvester.publisher;

import com.eventharvester.Fixtures;
import com.eventharvester.model.Event;
import com.eventharvester.model.NormalizedEvent;
import com.eventharvester.parser.TemporalParser;
import com.eventharvester.repository.EventRepository;
import com.eventharvester.service.LinkSummary;
import com.eventharvester.service.VenueLinkService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatcher;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DirectStorePublisherTest {

    private EventRepository eventRepository;
    private VenueLinkService venueLinkService;
    private DirectStorePublisher publisher;

    @BeforeEach
    void setUp() {
        eventRepository = mock(EventRepository.class);
        venueLinkService = mock(VenueLinkService.class);
        publisher = new DirectStorePublisher(eventRepository, venueLinkService,
                new IngestionPayloadMapper(Fixtures.clock()), new TemporalParser(Fixtures.clock()));
        when(eventRepository.findFirstBySourceUrl(anyString())).thenReturn(Optional.empty());
        when(eventRepository.findFirstByTitleAndStartDateTime(anyString(), any())).thenReturn(Optional.empty());
        when(eventRepository.saveAndFlush(any(Event.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(venueLinkService.linkUnlinkedEvents()).thenReturn(new LinkSummary(1, 0, 0));
    }

    private static NormalizedEvent event(String title, String sourceUrl) {
        return NormalizedEvent.builder()
                .title(title)
                .startDate(LocalDate.of(2025, 11, 26))
                .startTime("20:30")
                .venueName("Club Test")
                .city("Wien")
                .price("Free / Gratis")
                .source("club-test-scraper")
                .sourceUrl(sourceUrl)
                .artists(List.of("Nina", "Max"))
                .build();
    }

    private static PublishOptions options() {
        return PublishOptions.builder().source("club-test-scraper").city("Wien").build();
    }

    @Test
    void testInsertsNewEvent() {
        PublishResult result = publisher.publish(List.of(event("Jazz", "https://club.test/e/jazz")), options());

        assertEquals(1, result.getInserted());
        assertEquals(new LinkSummary(1, 0, 0), result.getLinkSummary());

        ArgumentCaptor<Event> saved = ArgumentCaptor.forClass(Event.class);
        verify(eventRepository).saveAndFlush(saved.capture());
        Event stored = saved.getValue();
        assertEquals(Instant.parse("2025-11-26T19:30:00Z"), stored.getStartDateTime());
        assertTrue(stored.isFree());
        assertEquals("Nina, Max", stored.getTags());
        assertEquals("club-test-jazz-2025-11-26", stored.getSlug());
        assertNull(stored.getVenueId());
    }

    @Test
    void testUpdatesBySourceUrl() {
        Event existing = Event.builder().id(5L).title("Old title").city("Wien").source("club-test-scraper").build();
        when(eventRepository.findFirstBySourceUrl("https://club.test/e/jazz")).thenReturn(Optional.of(existing));

        PublishResult result = publisher.publish(List.of(event("Jazz", "https://club.test/e/jazz")), options());

        assertEquals(0, result.getInserted());
        assertEquals(1, result.getUpdated());
        assertEquals("Jazz", existing.getTitle());
        assertEquals(5L, existing.getId());
    }

    @Test
    void testUpdatesByTitleAndStartWithoutSourceUrl() {
        Event existing = Event.builder().id(6L).title("Jazz").city("Wien").source("club-test-scraper").build();
        when(eventRepository.findFirstByTitleAndStartDateTime("Jazz", Instant.parse("2025-11-26T19:30:00Z")))
                .thenReturn(Optional.of(existing));

        PublishResult result = publisher.publish(List.of(event("Jazz", null)), options());

        assertEquals(1, result.getUpdated());
        verify(eventRepository, never()).findFirstBySourceUrl(anyString());
    }

    @Test
    void testStoreFailureIsCountedPerEvent() {
        ArgumentMatcher<Event> broken = e -> "Broken".equals(e.getTitle());
        when(eventRepository.saveAndFlush(argThat(broken)))
                .thenThrow(new DataIntegrityViolationException("unique_event"));

        PublishResult result = publisher.publish(
                List.of(event("Broken", "https://club.test/e/broken"), event("Jazz", "https://club.test/e/jazz")),
                options());

        assertEquals(1, result.getInserted());
        assertEquals(1, result.getFailed());
        assertTrue(result.getErrors().get(0).contains("Broken"));
    }

    @Test
    void testDryRunWritesNothing() {
        PublishResult result = publisher.publish(List.of(event("Jazz", null)),
                PublishOptions.builder().source("club-test-scraper").dryRun(true).build());

        assertTrue(result.isDryRun());
        assertEquals(1, result.getPayload().size());
        verifyNoInteractions(eventRepository, venueLinkService);
    }

    @Test
    void testNoLinkingWhenNothingWasWritten() {
        PublishResult result = publisher.publish(List.of(), options());

        assertNull(result.getLinkSummary());
        verifyNoInteractions(venueLinkService);
    }
}

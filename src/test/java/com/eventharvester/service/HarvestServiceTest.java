package com.eventharvester.service;

import com.eventharvester.Fixtures;
import com.eventharvester.collector.CollectionResult;
import com.eventharvester.collector.WindowedCollector;
import com.eventharvester.exception.SourceConfigurationException;
import com.eventharvester.model.NormalizedEvent;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import com.eventharvester.parser.EventNormalizer;
import com.eventharvester.parser.TemporalParser;
import com.eventharvester.publisher.EventPublisher;
import com.eventharvester.publisher.PublishOptions;
import com.eventharvester.publisher.PublishResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class HarvestServiceTest {

    private SourceRegistry registry;
    private WindowedCollector collector;
    private EventPublisher publisher;
    private EventNormalizer normalizer;
    private SourceConfig config;
    private List<NormalizedEvent> publishedEvents;

    @BeforeEach
    void setUp() {
        registry = mock(SourceRegistry.class);
        collector = mock(WindowedCollector.class);
        publisher = mock(EventPublisher.class);
        normalizer = new EventNormalizer(new TemporalParser(Fixtures.clock()), Fixtures.clock());
        config = Fixtures.cardSource();
        when(publisher.publish(anyList(), any(PublishOptions.class))).thenAnswer(invocation -> {
            publishedEvents = invocation.getArgument(0);
            return new PublishResult();
        });
    }

    private HarvestService service(boolean dryRun) {
        return new HarvestService(registry, collector, normalizer, publisher, dryRun, false, true);
    }

    private static CollectionResult collected(RawFieldSet... fieldSets) {
        CollectionResult result = mock(CollectionResult.class);
        when(result.getFieldSets()).thenReturn(List.of(fieldSets));
        when(result.getPagesFetched()).thenReturn(1);
        return result;
    }

    private static RawFieldSet raw(String title, String date, String url) {
        return RawFieldSet.builder().title(title).dateText(date).detailUrl(url).build();
    }

    @Test
    void testPipelineCounts() {
        CollectionResult result = collected(
                raw("Opening", "5.12.2025", "https://club.test/e/1"),
                raw(null, "6.12.2025", "https://club.test/e/2"),
                raw("Old Night", "1.11.2025", "https://club.test/e/3"),
                raw("Opening", "5.12.2025", "https://club.test/e/1"));
        when(collector.collect(config)).thenReturn(result);

        HarvestReport report = service(false).harvest(config);

        assertEquals(4, report.getExtracted());
        assertEquals(1, report.getDiscarded());
        assertEquals(1, report.getPastFiltered());
        assertEquals(1, report.getCollapsed());
        assertEquals(1, report.getPublished());
        assertFalse(report.isSkipped());

        ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
        verify(publisher).publish(anyList(), options.capture());
        assertEquals(1, publishedEvents.size());
        assertEquals("Opening", publishedEvents.get(0).getTitle());
        assertEquals("club-test-scraper", options.getValue().getSource());
        assertEquals("Wien", options.getValue().getCity());
        assertEquals("23:00", options.getValue().getDefaultTime());
        assertFalse(options.getValue().isDryRun());
    }

    @Test
    void testDryRunFlagReachesPublisher() {
        CollectionResult result = collected(raw("Opening", "5.12.2025", null));
        when(collector.collect(config)).thenReturn(result);

        service(true).harvest(config);

        ArgumentCaptor<PublishOptions> options = ArgumentCaptor.forClass(PublishOptions.class);
        verify(publisher).publish(anyList(), options.capture());
        assertTrue(options.getValue().isDryRun());
    }

    @Test
    void testSkippedCollectionIsNotPublished() {
        CollectionResult skipped = mock(CollectionResult.class);
        when(skipped.isSkipped()).thenReturn(true);
        when(collector.collect(config)).thenReturn(skipped);

        HarvestReport report = service(false).harvest(config);

        assertTrue(report.isSkipped());
        verifyNoInteractions(publisher);
    }

    @Test
    void testDisabledSourceIsNotCollected() {
        SourceConfig disabled = config.toBuilder().enabled(false).build();

        assertTrue(service(false).harvest(disabled).isSkipped());
        verifyNoInteractions(collector);
    }

    @Test
    void testOneFailingSourceDoesNotStopTheRun() {
        SourceConfig broken = config.toBuilder().key("broken").build();
        when(registry.enabled()).thenReturn(List.of(broken, config));
        when(collector.collect(broken)).thenThrow(new IllegalStateException("boom"));
        CollectionResult result = collected(raw("Opening", "5.12.2025", null));
        when(collector.collect(config)).thenReturn(result);

        List<HarvestReport> reports = service(false).harvestAll();

        assertEquals(1, reports.size());
        assertEquals("club-test", reports.get(0).getSource());
    }

    @Test
    void testUnknownSourceKey() {
        when(registry.find("nope")).thenReturn(Optional.empty());

        assertThrows(SourceConfigurationException.class, () -> service(false).harvest("nope"));
    }

    @Test
    void testNoEnabledSources() {
        when(registry.enabled()).thenReturn(List.of());

        assertTrue(service(false).harvestAll().isEmpty());
        verifyNoInteractions(collector);
    }
}

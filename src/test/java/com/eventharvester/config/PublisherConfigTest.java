package com.eventharvester.config;

import com.eventharvester.Fixtures;
import com.eventharvester.parser.TemporalParser;
import com.eventharvester.publisher.DirectStorePublisher;
import com.eventharvester.publisher.DryRunPublisher;
import com.eventharvester.publisher.EventPublisher;
import com.eventharvester.publisher.IngestionPayloadMapper;
import com.eventharvester.publisher.RemoteIngestionPublisher;
import com.eventharvester.repository.EventRepository;
import com.eventharvester.service.VenueLinkService;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PublisherConfigTest {

    private final PublisherConfig config = new PublisherConfig();

    private EventPublisher publisher(String url, String token, boolean storeEnabled) {
        return config.eventPublisher(new RestTemplate(), new IngestionPayloadMapper(Fixtures.clock()),
                mock(EventRepository.class), mock(VenueLinkService.class), new TemporalParser(Fixtures.clock()),
                url, token, true, storeEnabled);
    }

    @Test
    void testRemoteWinsWhenCredentialsAreSet() {
        assertTrue(publisher("https://ingest.test/api", "token", true) instanceof RemoteIngestionPublisher);
    }

    @Test
    void testDirectStoreWhenEnabled() {
        assertTrue(publisher("https://ingest.test/api", "", true) instanceof DirectStorePublisher);
    }

    @Test
    void testFallsBackToDryRun() {
        assertTrue(publisher("", "", false) instanceof DryRunPublisher);
    }
}

package com.eventharvester.publisher;

import com.eventharvester.Fixtures;
import com.eventharvester.model.NormalizedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RemoteIngestionPublisherTest {

    private static final String URL = "https://ingest.test/api/events/ingest";

    private MockRestServiceServer server;
    private RemoteIngestionPublisher publisher;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        publisher = new RemoteIngestionPublisher(restTemplate, new IngestionPayloadMapper(Fixtures.clock()),
                URL, "secret-token", true);
    }

    private static List<NormalizedEvent> events() {
        return List.of(
                NormalizedEvent.builder().title("Techno Tuesday").startDate(LocalDate.of(2025, 11, 25))
                        .startTime("23:00").source("club-test-scraper").build(),
                NormalizedEvent.builder().title("Secret Guest").source("club-test-scraper").build());
    }

    private static PublishOptions options(boolean dryRun) {
        return PublishOptions.builder().source("club-test-scraper").city("Wien").dryRun(dryRun).build();
    }

    @Test
    void testPostsBatchWithBearerToken() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret-token"))
                .andExpect(jsonPath("$.events.length()").value(1))
                .andExpect(jsonPath("$.events[0].startDateTime").value("2025-11-25T22:00:00Z"))
                .andExpect(jsonPath("$.options.source").value("club-test-scraper"))
                .andExpect(jsonPath("$.options.syncToCache").value(true))
                .andRespond(withSuccess("{\"inserted\":1,\"updated\":0,\"failed\":0,\"venuesCreated\":1,"
                        + "\"errors\":[],\"requestId\":\"abc\"}", MediaType.APPLICATION_JSON));

        PublishResult result = publisher.publish(events(), options(false));

        server.verify();
        assertEquals(1, result.getInserted());
        assertEquals(1, result.getVenuesCreated());
        // The dateless event fails before sending
        assertEquals(1, result.getFailed());
        assertFalse(result.isDryRun());
    }

    @Test
    void testServerErrorFailsWholeBatch() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        PublishResult result = publisher.publish(events(), options(false));

        server.verify();
        assertEquals(0, result.getInserted());
        assertEquals(2, result.getFailed());
        assertEquals(2, result.getErrors().size());
    }

    @Test
    void testDryRunNeverCallsEndpoint() {
        PublishResult result = publisher.publish(events(), options(true));

        server.verify();
        assertTrue(result.isDryRun());
        assertEquals(1, result.getPayload().size());
    }

    @Test
    void testNothingToSend() {
        PublishResult result = publisher.publish(List.of(events().get(1)), options(false));

        server.verify();
        assertEquals(1, result.getFailed());
    }
}

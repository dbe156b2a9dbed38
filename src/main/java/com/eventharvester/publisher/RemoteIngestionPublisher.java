package com.eventharvester.publisher;

import com.eventharvester.exception.PublishException;
import com.eventharvester.model.NormalizedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Sends batches to the remote ingestion endpoint with a Bearer token.
 * <p>
 * Ошибка вызова помечает весь пакет как неудачный; прогон продолжается.
 */
@Slf4j
public class RemoteIngestionPublisher implements EventPublisher {

    private final RestTemplate restTemplate;
    private final IngestionPayloadMapper mapper;
    private final DryRunPublisher dryRunPublisher;
    private final String ingestionUrl;
    private final String token;
    private final boolean syncToCache;

    public RemoteIngestionPublisher(RestTemplate restTemplate, IngestionPayloadMapper mapper,
                                    String ingestionUrl, String token, boolean syncToCache) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.dryRunPublisher = new DryRunPublisher(mapper);
        this.ingestionUrl = ingestionUrl;
        this.token = token;
        this.syncToCache = syncToCache;
    }

    @Override
    public PublishResult publish(List<NormalizedEvent> events, PublishOptions options) {
        // Пробный прогон никогда не обращается к удаленному сервису
        if (options.isDryRun()) {
            return dryRunPublisher.publish(events, options);
        }

        PublishResult result = new PublishResult();
        List<IngestionEvent> payload = new ArrayList<>();
        for (NormalizedEvent event : events) {
            IngestionEvent item = mapper.toPayload(event, options.getDefaultTime());
            if (item == null) {
                result.fail("Missing start date: " + event.getTitle());
            } else {
                payload.add(item);
            }
        }
        if (payload.isEmpty()) {
            log.info("Nothing to send for {}", options.getSource());
            return result;
        }

        IngestionRequest request = IngestionRequest.builder()
                .events(payload)
                .options(IngestionRequest.Options.builder()
                        .source(options.getSource())
                        .city(options.getCity())
                        .dryRun(false)
                        .debug(options.isDebug())
                        .syncToCache(syncToCache)
                        .build())
                .build();

        try {
            IngestionResponse response = send(request);
            result.setInserted(response.getInserted());
            result.setUpdated(response.getUpdated());
            result.setFailed(result.getFailed() + response.getFailed());
            result.setVenuesCreated(response.getVenuesCreated());
            if (response.getErrors() != null) {
                result.getErrors().addAll(response.getErrors());
            }
            log.info("Ingestion for {}: {} inserted, {} updated, {} failed, {} venues created", options.getSource(),
                    result.getInserted(), result.getUpdated(), result.getFailed(), result.getVenuesCreated());
        } catch (PublishException e) {
            log.error("Ingestion failed for {}: {}", options.getSource(), e.getMessage(), e);
            result.setFailed(result.getFailed() + payload.size());
            result.getErrors().add(e.getMessage());
        }
        return result;
    }

    IngestionResponse send(IngestionRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(token);

        try {
            ResponseEntity<IngestionResponse> response = restTemplate.postForEntity(
                    ingestionUrl, new HttpEntity<>(request, headers), IngestionResponse.class);
            if (response.getBody() == null) {
                throw new PublishException("Empty response from ingestion endpoint " + ingestionUrl);
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw new PublishException("Ingestion request to " + ingestionUrl + " failed: " + e.getMessage(), e);
        }
    }
}

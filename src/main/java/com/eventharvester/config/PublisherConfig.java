package com.eventharvester.config;

import com.eventharvester.parser.TemporalParser;
import com.eventharvester.publisher.DirectStorePublisher;
import com.eventharvester.publisher.DryRunPublisher;
import com.eventharvester.publisher.EventPublisher;
import com.eventharvester.publisher.IngestionPayloadMapper;
import com.eventharvester.publisher.RemoteIngestionPublisher;
import com.eventharvester.repository.EventRepository;
import com.eventharvester.service.VenueLinkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Selects the publishing strategy from the configured credentials.
 * <p>
 * Порядок выбора: удаленный прием (URL и токен заданы), прямая запись в базу
 * (harvester.store.enabled=true), иначе пробный прогон с предупреждением.
 */
@Slf4j
@Configuration
public class PublisherConfig {

    @Bean
    public EventPublisher eventPublisher(RestTemplate restTemplate,
                                         IngestionPayloadMapper mapper,
                                         EventRepository eventRepository,
                                         VenueLinkService venueLinkService,
                                         TemporalParser temporalParser,
                                         @Value("${harvester.ingestion.url:}") String ingestionUrl,
                                         @Value("${harvester.ingestion.token:}") String ingestionToken,
                                         @Value("${harvester.ingestion.sync-to-cache:true}") boolean syncToCache,
                                         @Value("${harvester.store.enabled:false}") boolean storeEnabled) {
        if (!ingestionUrl.isBlank() && !ingestionToken.isBlank()) {
            log.info("Publishing to ingestion endpoint {}", ingestionUrl);
            return new RemoteIngestionPublisher(restTemplate, mapper, ingestionUrl, ingestionToken, syncToCache);
        }
        if (storeEnabled) {
            log.info("Publishing directly to the event store");
            return new DirectStorePublisher(eventRepository, venueLinkService, mapper, temporalParser);
        }
        log.warn("Neither harvester.ingestion.url/token nor harvester.store.enabled is configured; "
                + "every run is a dry run");
        return new DryRunPublisher(mapper);
    }
}

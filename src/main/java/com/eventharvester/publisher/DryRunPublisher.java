package com.eventharvester.publisher;

import com.eventharvester.model.NormalizedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Builds the would-be ingestion payload without writing anything.
 * <p>
 * Используется при harvester.dry-run=true, а также когда не настроен ни удаленный прием,
 * ни прямая запись в базу.
 */
@Slf4j
public class DryRunPublisher implements EventPublisher {

    private final IngestionPayloadMapper mapper;

    public DryRunPublisher(IngestionPayloadMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public PublishResult publish(List<NormalizedEvent> events, PublishOptions options) {
        PublishResult result = PublishResult.builder().dryRun(true).build();
        for (NormalizedEvent event : events) {
            IngestionEvent payload = mapper.toPayload(event, options.getDefaultTime());
            if (payload == null) {
                result.fail("Missing start date: " + event.getTitle());
                continue;
            }
            result.getPayload().add(payload);
            if (options.isDebug()) {
                log.info("[dry-run] {} | {} | {}", payload.getStartDateTime(), payload.getTitle(), payload.getSourceUrl());
            }
        }
        log.info("[dry-run] {}: {} events would be published, {} without start date",
                options.getSource(), result.getPayload().size(), result.getFailed());
        return result;
    }
}

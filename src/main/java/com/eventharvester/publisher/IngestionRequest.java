package com.eventharvester.publisher;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of {@code POST harvester.ingestion.url}.
 */
@Value
@Builder
@Jacksonized
public class IngestionRequest {

    List<IngestionEvent> events;
    Options options;

    @Value
    @Builder
    @Jacksonized
    public static class Options {
        String source;
        String city;
        boolean dryRun;
        boolean debug;
        boolean syncToCache;
    }
}

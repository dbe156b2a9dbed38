package com.eventharvester.service;

import com.eventharvester.publisher.PublishResult;
import lombok.Builder;
import lombok.Value;

/**
 * Statistics of one source run.
 */
@Value
@Builder
public class HarvestReport {

    String source;
    boolean skipped;
    int pagesFetched;
    int pagesFailed;
    int extracted;
    int discarded;     // без названия
    int pastFiltered;  // отброшены фильтром "только будущие"
    int collapsed;     // дубликаты между окнами
    int published;
    PublishResult publishResult;

    public static HarvestReport skipped(String source) {
        return HarvestReport.builder().source(source).skipped(true).build();
    }
}

package com.eventharvester.publisher;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PublishOptions {

    String source;
    String city;
    boolean dryRun;
    boolean debug;

    /** Start time used when an event has a date but no time. */
    @Builder.Default
    String defaultTime = "23:00";
}

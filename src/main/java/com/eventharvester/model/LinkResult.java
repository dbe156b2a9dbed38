package com.eventharvester.model;

import lombok.Value;

/**
 * Outcome of resolving one event against the venue registry.
 */
@Value
public class LinkResult {

    Long eventId;
    Long venueId;
    boolean matched;

    public static LinkResult matched(Long eventId, Long venueId) {
        return new LinkResult(eventId, venueId, true);
    }

    public static LinkResult unmatched(Long eventId) {
        return new LinkResult(eventId, null, false);
    }
}

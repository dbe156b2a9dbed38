package com.eventharvester.service;

import com.eventharvester.model.Event;
import com.eventharvester.model.LinkResult;
import com.eventharvester.model.Venue;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves events to venue registry entries by exact match of (normalized name, city).
 * <p>
 * Сопоставление только точное после нормализации, без нечеткого поиска.
 * Счетчик несопоставленных событий относится к одному прогону связывания.
 */
@Slf4j
public class VenueMatcher {

    @Getter
    private int unmatchedCount;

    /**
     * Index the registry; the first entry wins when two venues share a key.
     */
    public static Map<VenueKey, Venue> buildLookup(Collection<Venue> venues) {
        Map<VenueKey, Venue> lookup = new HashMap<>();
        for (Venue venue : venues) {
            VenueKey key = VenueKey.of(venue.getName(), venue.getCity());
            if (lookup.putIfAbsent(key, venue) != null) {
                log.debug("Duplicate registry entry for {} ignored (venue id {})", key, venue.getId());
            }
        }
        return lookup;
    }

    /**
     * Set the event's venue id when the registry knows its venue.
     * An event that already carries a venue id is left untouched.
     */
    public LinkResult link(Event event, Map<VenueKey, Venue> lookup) {
        if (event.getVenueId() != null) {
            return LinkResult.matched(event.getId(), event.getVenueId());
        }
        Venue venue = lookup.get(VenueKey.of(event.getVenueName(), event.getCity()));
        if (venue == null) {
            unmatchedCount++;
            return LinkResult.unmatched(event.getId());
        }
        event.setVenueId(venue.getId());
        return LinkResult.matched(event.getId(), venue.getId());
    }
}

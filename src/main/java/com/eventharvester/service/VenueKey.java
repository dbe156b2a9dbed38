package com.eventharvester.service;

import com.eventharvester.model.Venue;
import lombok.Value;

import java.util.Locale;

/**
 * Exact lookup key of the venue registry: normalized name plus lower-cased city.
 */
@Value
public class VenueKey {
    String name;
    String city;

    public static VenueKey of(String venueName, String city) {
        return new VenueKey(Venue.normalize(venueName), city == null ? "" : city.toLowerCase(Locale.ROOT).trim());
    }
}

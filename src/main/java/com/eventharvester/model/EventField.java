package com.eventharvester.model;

import java.util.Locale;

/**
 * Logical fields the extractor knows how to pull out of an event card or detail page.
 */
public enum EventField {
    TITLE,
    DATE,
    TIME,
    PRICE,
    LINK,
    IMAGE,
    DESCRIPTION,
    ARTISTS,
    TICKET;

    /**
     * Key used for this field in the JSON source configuration.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.eventharvester.service;

import com.eventharvester.model.Event;
import com.eventharvester.model.LinkResult;
import com.eventharvester.model.Venue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VenueMatcherTest {

    private static Venue venue(long id, String name, String city) {
        return Venue.builder().id(id).name(name).city(city).build();
    }

    private static Event event(String venueName, String city) {
        return Event.builder().id(7L).title("Night").venueName(venueName).city(city).build();
    }

    @Test
    void testMatchesAfterNormalization() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(List.of(venue(1, "Grelle Forelle", "Wien")));
        VenueMatcher matcher = new VenueMatcher();
        Event event = event("  grelle   FORELLE ", "wien");

        LinkResult result = matcher.link(event, lookup);

        assertTrue(result.isMatched());
        assertEquals(1L, result.getVenueId());
        assertEquals(1L, event.getVenueId());
        assertEquals(0, matcher.getUnmatchedCount());
    }

    @Test
    void testCityIsPartOfTheKey() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(List.of(venue(1, "Flex", "Wien")));
        VenueMatcher matcher = new VenueMatcher();
        Event event = event("Flex", "Graz");

        assertFalse(matcher.link(event, lookup).isMatched());
        assertNull(event.getVenueId());
        assertEquals(1, matcher.getUnmatchedCount());
    }

    @Test
    void testNoFuzzyMatching() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(List.of(venue(1, "Das Werk", "Wien")));

        assertFalse(new VenueMatcher().link(event("Werk", "Wien"), lookup).isMatched());
    }

    @Test
    void testAlreadyLinkedEventIsLeftAlone() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(List.of(venue(1, "Flex", "Wien")));
        Event event = event("Flex", "Wien");
        event.setVenueId(99L);

        LinkResult result = new VenueMatcher().link(event, lookup);

        assertTrue(result.isMatched());
        assertEquals(99L, event.getVenueId());
    }

    @Test
    void testFirstRegistryEntryWins() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(List.of(
                venue(1, "U4", "Wien"), venue(2, "u4 ", "WIEN")));

        assertEquals(1, lookup.size());
        assertEquals(1L, lookup.get(VenueKey.of("U4", "Wien")).getId());
    }
}

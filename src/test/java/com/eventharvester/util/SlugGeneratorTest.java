package com.eventharvester.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SlugGeneratorTest {

    @Test
    void testSlugify() {
        assertEquals("grelle-forelle", SlugGenerator.slugify("Grelle Forelle"));
        assertEquals("praterstrasse-muenchen", SlugGenerator.slugify("Praterstraße  München"));
        assertEquals("cafe-rhiz", SlugGenerator.slugify("Café Rhiz!"));
        assertEquals("", SlugGenerator.slugify(null));
        assertEquals("", SlugGenerator.slugify(" -- "));
    }

    @Test
    void testEventSlug() {
        assertEquals("flex-techno-tuesday-2025-11-25",
                SlugGenerator.eventSlug("Flex", "Techno Tuesday", LocalDate.of(2025, 11, 25)));
        assertEquals("flex-techno-tuesday", SlugGenerator.eventSlug("Flex", "Techno Tuesday", null));
        assertEquals("flex-event", SlugGenerator.eventSlug("Flex", "!!!", null));
    }

    @Test
    void testEventSlugIsCapped() {
        String slug = SlugGenerator.eventSlug("Flex", "x".repeat(400), LocalDate.of(2025, 11, 25));

        assertEquals(200, slug.length());
        assertTrue(slug.startsWith("flex-xxx"));
    }
}

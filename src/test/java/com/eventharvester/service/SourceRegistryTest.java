package com.eventharvester.service;

import com.eventharvester.exception.SourceConfigurationException;
import com.eventharvester.model.PageShape;
import com.eventharvester.model.SourceConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private static SourceRegistry load(String file, String selected) {
        SourceRegistry registry = new SourceRegistry(new ObjectMapper(), new DefaultResourceLoader(), file, selected);
        registry.afterPropertiesSet();
        return registry;
    }

    @Test
    void testLoadsBundledSources() {
        SourceRegistry registry = load("classpath:venue-sources.json", "");

        assertEquals(13, registry.all().size());
        assertEquals(11, registry.enabled().size());
        assertFalse(registry.find("camera-club").orElseThrow().isEnabled());

        SourceConfig grelle = registry.find("grelle-forelle").orElseThrow();
        assertEquals(PageShape.SELECTOR_CHAIN, grelle.getShape());
        assertTrue(grelle.isDateInTitle());
        assertEquals("Wien", grelle.getCity());

        SourceConfig ibiza = registry.find("ibiza-spotlight").orElseThrow();
        assertTrue(ibiza.isWindowed());
        assertEquals("dd/MM/yyyy", ibiza.getWindow().getDatePattern());
        assertEquals("Ibiza", ibiza.getCity());
    }

    @Test
    void testSelectedKeysNarrowEnabledSources() {
        SourceRegistry registry = load("classpath:venue-sources.json", "flex, rhiz ,camera-club");

        List<String> keys = registry.enabled().stream().map(SourceConfig::getKey).collect(Collectors.toList());

        // A disabled source stays disabled even when selected
        assertEquals(List.of("flex", "rhiz"), keys);
    }

    @Test
    void testUnknownKey() {
        assertTrue(load("classpath:venue-sources.json", "").find("nope").isEmpty());
    }

    @Test
    void testDuplicateKeyIsRejected() {
        SourceConfigurationException e = assertThrows(SourceConfigurationException.class,
                () -> load("classpath:registry/duplicate-keys.json", ""));

        assertEquals("Duplicate source key 'rhiz'", e.getMessage());
        assertNull(e.getCause());
    }

    @Test
    void testSourceWithoutUrlIsRejected() {
        assertThrows(SourceConfigurationException.class, () -> load("classpath:registry/missing-url.json", ""));
    }

    @Test
    void testUnreadableFileIsFatal() {
        assertThrows(SourceConfigurationException.class, () -> load("classpath:registry/not-json.json", ""));
        assertThrows(SourceConfigurationException.class, () -> load("classpath:registry/absent.json", ""));
    }
}

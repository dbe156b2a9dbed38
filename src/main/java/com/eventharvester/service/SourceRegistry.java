package com.eventharvester.service;

import com.eventharvester.exception.SourceConfigurationException;
import com.eventharvester.model.SourceConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-source configuration loaded from a JSON array at startup.
 * <p>
 * Невозможность прочитать файл источников - единственная фатальная ошибка при запуске.
 */
@Slf4j
@Component
public class SourceRegistry implements InitializingBean {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String sourcesFile;
    private final Set<String> selectedKeys;

    private final Map<String, SourceConfig> sources = new LinkedHashMap<>();

    public SourceRegistry(ObjectMapper objectMapper,
                          ResourceLoader resourceLoader,
                          @Value("${harvester.sources-file:classpath:venue-sources.json}") String sourcesFile,
                          @Value("${harvester.sources:}") String selectedSources) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.sourcesFile = sourcesFile;
        this.selectedKeys = Arrays.stream(selectedSources.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }

    @Override
    public void afterPropertiesSet() {
        Resource resource = resourceLoader.getResource(sourcesFile);
        List<SourceConfig> loaded;
        try (InputStream in = resource.getInputStream()) {
            loaded = objectMapper.readValue(in, new TypeReference<List<SourceConfig>>() {});
        } catch (IOException e) {
            throw new SourceConfigurationException("Cannot read source configuration " + sourcesFile, e);
        }

        for (SourceConfig config : loaded) {
            validate(config);
            if (sources.putIfAbsent(config.getKey(), config) != null) {
                throw new SourceConfigurationException("Duplicate source key '" + config.getKey() + "'");
            }
        }
        log.info("Loaded {} sources from {} ({} enabled)", sources.size(), sourcesFile, enabled().size());
    }

    public List<SourceConfig> all() {
        return Collections.unmodifiableList(new ArrayList<>(sources.values()));
    }

    /**
     * Enabled sources, narrowed to {@code harvester.sources} when that list is set.
     */
    public List<SourceConfig> enabled() {
        return sources.values().stream()
                .filter(SourceConfig::isEnabled)
                .filter(s -> selectedKeys.isEmpty() || selectedKeys.contains(s.getKey()))
                .collect(Collectors.toList());
    }

    public Optional<SourceConfig> find(String key) {
        return Optional.ofNullable(sources.get(key));
    }

    private static void validate(SourceConfig config) {
        if (config.getKey() == null || config.getKey().isBlank()) {
            throw new SourceConfigurationException("Source without key: " + config.getVenueName());
        }
        if (config.getVenueName() == null || config.getVenueName().isBlank()) {
            throw new SourceConfigurationException("Source '" + config.getKey() + "' has no venueName");
        }
        if (!config.isWindowed() && config.listingUrls().isEmpty()) {
            throw new SourceConfigurationException("Source '" + config.getKey() + "' has neither eventsUrl nor window");
        }
    }
}

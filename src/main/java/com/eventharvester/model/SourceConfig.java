package com.eventharvester.model;

import com.eventharvester.util.SlugGenerator;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one listing source: venue constants, listing URLs and the
 * selector lists that drive the extraction engine.
 * <p>
 * Конфигурация источника задается данными (JSON), а не кодом: одна реализация парсера
 * обслуживает все площадки.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SourceConfig {

    String key;
    String venueName;
    String venueAddress;

    @Builder.Default
    String city = "Wien";

    @Builder.Default
    String country = "Austria";

    String baseUrl;
    String eventsUrl;

    @Singular
    List<String> additionalUrls;

    @Builder.Default
    String category = "Clubs/Discos";

    @Builder.Default
    String subcategory = "Electronic";

    String logoUrl;

    /** Explicit shape; when null the static lookup in the classifier decides. */
    PageShape shape;

    @Singular
    List<String> containerSelectors;

    @Singular
    Map<String, List<String>> fieldSelectors;

    @Singular
    Map<String, List<String>> detailSelectors;

    boolean useDetailPages;
    boolean dateInTitle;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    String defaultTime = "23:00";

    WindowSpec window;

    public List<String> selectorsFor(EventField field) {
        return fieldSelectors.getOrDefault(field.key(), List.of());
    }

    public List<String> detailSelectorsFor(EventField field) {
        return detailSelectors.getOrDefault(field.key(), List.of());
    }

    public boolean isWindowed() {
        return window != null && window.getUrlTemplate() != null;
    }

    /**
     * All listing pages of a non-windowed source: the events URL followed by any additional pages.
     */
    public List<String> listingUrls() {
        List<String> urls = new ArrayList<>();
        if (eventsUrl != null) {
            urls.add(eventsUrl);
        }
        urls.addAll(additionalUrls);
        return urls;
    }

    /**
     * A listing URL shared by every entry of a page does not identify a single event.
     */
    public boolean isListingUrl(String url) {
        if (url == null) {
            return false;
        }
        String candidate = stripTrailingSlash(url);
        if (candidate.equals(stripTrailingSlash(baseUrl))) {
            return true;
        }
        return listingUrls().stream().map(SourceConfig::stripTrailingSlash).anyMatch(candidate::equals);
    }

    /**
     * Name of the scraper recorded as the event source, e.g. "grelle-forelle-scraper".
     */
    public String sourceName() {
        return SlugGenerator.slugify(venueName) + "-scraper";
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

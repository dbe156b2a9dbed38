package com.eventharvester.parser;

import com.eventharvester.model.NormalizedEvent;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import com.eventharvester.parser.TemporalParser.DateMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts raw field sets into the canonical event schema.
 * <p>
 * Преобразование выполняется один раз на запись; константы площадки (название, адрес, город,
 * категория) берутся из конфигурации источника.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventNormalizer {

    private final TemporalParser temporalParser;
    private final Clock clock;

    /**
     * @return the normalized event, or empty when the entry has no usable title
     */
    public Optional<NormalizedEvent> normalize(RawFieldSet raw, SourceConfig config) {
        String title = collapse(raw.getTitle());
        if (title == null) {
            log.debug("Discarding entry without title from {} ({})", config.getKey(), raw.getDetailUrl());
            return Optional.empty();
        }

        LocalDate date = temporalParser.parseDate(raw.getDateText());
        if (date == null && config.isDateInTitle()) {
            // "15/11 CONTRAST": дата в начале названия
            Optional<DateMatch> match = temporalParser.findDate(title);
            if (match.isPresent()) {
                date = match.get().getDate();
                String stripped = collapse(title.substring(0, match.get().getStart()) + " "
                        + title.substring(match.get().getEnd()));
                if (stripped != null) {
                    title = stripped.replaceAll("^[\\s|:,–-]+", "");
                }
            }
        }

        String time = temporalParser.parseTime(raw.getTimeText());
        if (time == null) {
            time = temporalParser.parseTime(raw.getDateText());
        }

        String detailUrl = raw.getDetailUrl();
        String sourceUrl = config.isListingUrl(detailUrl) ? null : detailUrl;

        NormalizedEvent event = NormalizedEvent.builder()
                .title(title)
                .startDate(date)
                .startTime(time)
                .venueName(config.getVenueName())
                .venueAddress(config.getVenueAddress())
                .city(config.getCity())
                .country(config.getCountry())
                .category(config.getCategory())
                .subcategory(config.getSubcategory())
                .price(temporalParser.extractPrice(raw.getPriceText()))
                .description(collapse(raw.getDescription()))
                .imageUrl(raw.getImageUrl() != null ? raw.getImageUrl() : config.getLogoUrl())
                .ticketUrl(raw.getTicketUrl())
                .websiteUrl(detailUrl != null ? detailUrl : config.getEventsUrl())
                .source(config.sourceName())
                .sourceUrl(sourceUrl)
                .artists(dedupeArtists(raw.getArtists()))
                .build();
        return Optional.of(event);
    }

    /**
     * Drop events dated before today; events without a date are kept for manual review.
     */
    public List<NormalizedEvent> futureOnly(List<NormalizedEvent> events) {
        LocalDate today = LocalDate.now(clock);
        return events.stream()
                .filter(e -> e.getStartDate() == null || !e.getStartDate().isBefore(today))
                .collect(Collectors.toList());
    }

    /**
     * Case- and whitespace-insensitive dedup keeping the first spelling and order.
     */
    static List<String> dedupeArtists(List<String> artists) {
        if (artists == null) {
            return new ArrayList<>();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String artist : artists) {
            String cleaned = collapse(artist);
            if (cleaned != null) {
                unique.putIfAbsent(cleaned.toLowerCase(Locale.ROOT), cleaned);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }
}

package com.eventharvester.publisher;

import com.eventharvester.model.NormalizedEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Maps normalized events onto the ingestion contract.
 * <p>
 * startDateTime = дата + время (или время по умолчанию источника) в часовом поясе площадки,
 * переведенные в UTC.
 */
@Component
public class IngestionPayloadMapper {

    private static final LocalTime FALLBACK_TIME = LocalTime.of(23, 0);

    private final ZoneId zone;

    public IngestionPayloadMapper(Clock clock) {
        this.zone = clock.getZone();
    }

    /**
     * @return the start instant, or null when the event has no date
     */
    public Instant startInstant(NormalizedEvent event, String defaultTime) {
        if (event.getStartDate() == null) {
            return null;
        }
        LocalTime time = parseTime(event.getStartTime());
        if (time == null) {
            time = parseTime(defaultTime);
        }
        if (time == null) {
            time = FALLBACK_TIME;
        }
        return event.getStartDate().atTime(time).atZone(zone).toInstant();
    }

    /**
     * @return the payload entry, or null when no start instant can be formed
     */
    public IngestionEvent toPayload(NormalizedEvent event, String defaultTime) {
        Instant start = startInstant(event, defaultTime);
        if (start == null) {
            return null;
        }
        return IngestionEvent.builder()
                .title(event.getTitle())
                .venueName(event.getVenueName())
                .venueAddress(event.getVenueAddress())
                .venueCity(event.getCity())
                .category(event.getCategory())
                .startDateTime(start.toString())
                .price(event.getPrice())
                .ticketUrl(event.getTicketUrl())
                .websiteUrl(event.getWebsiteUrl())
                .imageUrl(event.getImageUrl())
                .source(event.getSource())
                .sourceUrl(event.getSourceUrl())
                .build();
    }

    private static LocalTime parseTime(String value) {
        if (value == null || !value.trim().matches("\\d{1,2}:\\d{2}")) {
            return null;
        }
        String[] parts = value.trim().split(":");
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        return hour < 24 && minute < 60 ? LocalTime.of(hour, minute) : null;
    }
}

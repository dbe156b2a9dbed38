package com.eventharvester;

import com.eventharvester.model.SourceConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Shared test data: HTML fixtures, a fixed clock and a typical card-based source.
 */
public final class Fixtures {

    public static final ZoneId VIENNA = ZoneId.of("Europe/Vienna");

    private Fixtures() {
    }

    /** 2025-11-20 11:00 in Vienna. */
    public static Clock clock() {
        return Clock.fixed(Instant.parse("2025-11-20T10:00:00Z"), VIENNA);
    }

    public static Document html(String name, String baseUri) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return Jsoup.parse(in, "UTF-8", baseUri);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Source matching fixtures/listing-cards.html. */
    public static SourceConfig cardSource() {
        return SourceConfig.builder()
                .key("club-test")
                .venueName("Club Test")
                .venueAddress("Teststraße 1, 1010 Wien")
                .baseUrl("https://club.test")
                .eventsUrl("https://club.test/programm/")
                .logoUrl("https://club.test/logo.png")
                .containerSelector("div.nothing")
                .containerSelector("article.event-card")
                .containerSelector("main")
                .fieldSelector("title", List.of(".missing", "h3.event-title"))
                .fieldSelector("date", List.of("time.event-date", "span.event-date"))
                .fieldSelector("time", List.of("span.event-time"))
                .fieldSelector("price", List.of("span.event-price"))
                .fieldSelector("image", List.of("img.event-image"))
                .fieldSelector("link", List.of("a.event-link"))
                .fieldSelector("artists", List.of("ul.lineup li"))
                .detailSelector("title", List.of("h1.entry-title"))
                .detailSelector("description", List.of("div.entry-content"))
                .detailSelector("image", List.of("img.hero"))
                .detailSelector("artists", List.of("ul.lineup li"))
                .detailSelector("ticket", List.of("a.ticket"))
                .build();
    }
}

package com.eventharvester.parser;

import com.eventharvester.exception.ExtractionException;
import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import com.eventharvester.parser.TemporalParser.DateMatch;
import com.eventharvester.parser.TemporalParser.MonthContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Listings published as free-form prose blocks, e.g.
 * <pre>
 * NOVEMBER
 * Freitag 21. November
 * 19:00 Uhr
 * Artist Night
 * </pre>
 * A line with a date opens a new entry; following short lines fill in time, price and title.
 * <p>
 * Строки-заголовки с названием месяца задают контекст для записей, где указан только день ("Fr 15.").
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlainTextListingParser implements ListingShapeParser {

    private static final int MAX_TIME_LINE = 25;
    private static final int MAX_PRICE_LINE = 80;

    private static final Set<String> NOISE = Set.of(
            "tickets", "ticket", "mehr info", "mehr infos", "more info", "info", "infos", "details",
            "read more", "weiterlesen", "mehr", "tickets kaufen", "buy tickets", "programm", "program",
            "facebook", "instagram", "»", "›", "→");

    private static final Pattern WEEKDAY_PREFIX = Pattern.compile(
            "^" + TemporalParser.WEEKDAY + "\\b\\.?,?\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern TIME_TOKEN = Pattern.compile(
            "(?i)(?:doors?|einlass|start|beginn)?\\s*:?\\s*\\d{1,2}:\\d{2}(?:\\s*[-–]\\s*\\d{1,2}:\\d{2})?\\s*(?:uhr)?");
    private static final Pattern PRICE_TAIL = Pattern.compile("(?i)(?:\\b(?:eintritt|vvk|ak|preis|eur)\\b|€).*$");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");

    private final FieldExtractor fieldExtractor;
    private final TemporalParser temporalParser;

    @Override
    public PageShape shape() {
        return PageShape.PLAIN_TEXT;
    }

    @Override
    public List<RawFieldSet> parse(Document document, SourceConfig config) {
        List<RawFieldSet> result = new ArrayList<>();
        for (Element block : blocksOf(document, config)) {
            try {
                result.addAll(parseLines(DocumentLines.of(block)));
            } catch (ExtractionException e) {
                // Ошибка в одном блоке не отменяет остальные блоки страницы
                log.warn("Skipping text block of {}: {}", config.getKey(), e.getMessage());
            }
        }
        log.debug("Plain-text parser found {} entries for {}", result.size(), config.getKey());
        return result;
    }

    List<RawFieldSet> parseLines(List<String> lines) {
        List<RawFieldSet> entries = new ArrayList<>();
        MonthContext context = null;
        RawFieldSet current = null;

        for (String line : lines) {
            if (NOISE.contains(line.toLowerCase(Locale.ROOT))) {
                continue;
            }

            MonthContext header = temporalParser.parseMonthHeader(line);
            if (header != null) {
                context = header;
                continue;
            }

            Optional<DateMatch> dateMatch = temporalParser.findDate(line);
            LocalDate dayInMonth = dateMatch.isEmpty() ? temporalParser.parseDate(line, context) : null;

            if (dateMatch.isPresent() || dayInMonth != null) {
                current = new RawFieldSet();
                entries.add(current);
                String remainder;
                if (dateMatch.isPresent()) {
                    DateMatch match = dateMatch.get();
                    current.setDateText(line.substring(match.getStart(), match.getEnd()));
                    remainder = line.substring(0, match.getStart()) + " " + line.substring(match.getEnd());
                } else {
                    current.setDateText(dayInMonth.toString());
                    remainder = "";
                }
                fillFromDateLine(current, remainder);
                continue;
            }

            if (current == null) {
                continue;
            }

            if (current.getTimeText() == null && line.length() <= MAX_TIME_LINE
                    && temporalParser.parseTime(line) != null) {
                current.setTimeText(line);
            } else if (current.getPriceText() == null && line.length() <= MAX_PRICE_LINE
                    && temporalParser.extractPrice(line) != null) {
                current.setPriceText(line);
            } else if (current.getTitle() == null) {
                current.setTitle(line);
            } else {
                current.setDescription(current.getDescription() == null
                        ? line : current.getDescription() + " " + line);
            }
        }
        return entries;
    }

    /**
     * The rest of a date line may carry time, price and the title itself:
     * "Do. 20.11.2025 18:00, Eintritt: € 24/26" or "do 100725 20:00 Live Band".
     */
    private void fillFromDateLine(RawFieldSet entry, String remainder) {
        String rest = remainder.trim();
        if (rest.isEmpty()) {
            return;
        }
        if (temporalParser.parseTime(rest) != null) {
            entry.setTimeText(rest);
        }
        if (temporalParser.extractPrice(rest) != null) {
            entry.setPriceText(rest);
        }

        String title = PRICE_TAIL.matcher(rest).replaceAll("");
        title = TIME_TOKEN.matcher(title).replaceAll(" ");
        title = WEEKDAY_PREFIX.matcher(title.trim()).replaceFirst("");
        title = title.replaceAll("^[\\s,.:|–-]+|[\\s,.:|–-]+$", "").replaceAll("\\s+", " ");
        if (title.length() >= 2 && LETTER.matcher(title).find()) {
            entry.setTitle(title);
        }
    }

    private List<Element> blocksOf(Document document, SourceConfig config) {
        Elements containers = fieldExtractor.selectContainers(document, config.getContainerSelectors());
        if (containers.isEmpty()) {
            return List.of(document.body());
        }
        return containers;
    }
}

package com.eventharvester.parser;

import com.eventharvester.exception.ExtractionException;
import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Listings where every event is one line of pipe-separated cells:
 * {@code "Night Name 15-11 | 23:00-06:00 | Club | Artist A, Artist B & Artist C"}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipeDelimitedListingParser implements ListingShapeParser {

    private static final Pattern DAY_MONTH = Pattern.compile("(?<!\\d)(\\d{1,2})-(\\d{1,2})(?!\\d)");
    private static final Pattern ARTIST_SEPARATOR = Pattern.compile("\\s*(?:,|&|\\+)\\s*");

    private final FieldExtractor fieldExtractor;
    private final TemporalParser temporalParser;

    @Override
    public PageShape shape() {
        return PageShape.PIPE_DELIMITED;
    }

    @Override
    public List<RawFieldSet> parse(Document document, SourceConfig config) {
        List<RawFieldSet> result = new ArrayList<>();
        for (String line : linesOf(document, config)) {
            if (!line.contains("|")) {
                continue;
            }
            try {
                RawFieldSet fields = parseLine(line);
                if (fields != null) {
                    result.add(fields);
                }
            } catch (ExtractionException e) {
                log.warn("Skipping record of {}: {}", config.getKey(), e.getMessage());
            }
        }
        log.debug("Pipe-delimited parser found {} records for {}", result.size(), config.getKey());
        return result;
    }

    RawFieldSet parseLine(String line) {
        List<String> cells = Arrays.stream(line.split("\\|"))
                .map(String::trim)
                .collect(Collectors.toList());
        String first = cells.get(0);
        Matcher date = DAY_MONTH.matcher(first);
        if (!date.find()) {
            return null;
        }
        int day = Integer.parseInt(date.group(1));
        int month = Integer.parseInt(date.group(2));
        if (temporalParser.parseDayMonth(day, month) == null) {
            return null;
        }

        String title = first.substring(0, date.start()).trim();
        if (title.isEmpty()) {
            title = first.substring(date.end()).trim();
        }

        RawFieldSet fields = new RawFieldSet();
        fields.setTitle(title.isEmpty() ? null : title);
        fields.setDateText(day + "." + month + ".");
        fields.setTimeText(temporalParser.parseTime(line));
        fields.setDescription(line);
        if (cells.size() >= 3) {
            List<String> artists = Arrays.stream(ARTIST_SEPARATOR.split(cells.get(cells.size() - 1)))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
            fields.setArtists(artists);
        }
        return fields;
    }

    private List<String> linesOf(Document document, SourceConfig config) {
        Elements containers = fieldExtractor.selectContainers(document, config.getContainerSelectors());
        if (containers.isEmpty()) {
            return DocumentLines.of(document.body());
        }
        List<String> lines = new ArrayList<>();
        for (Element container : containers) {
            lines.addAll(DocumentLines.of(container));
        }
        return lines;
    }
}

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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Program tables where each row holds the date in the first cell and title, prices and door time
 * mixed together in the second: {@code <td>So, 27.07.</td><td>Band Name VVK: 28,- Doors: 20h</td>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InlineTableListingParser implements ListingShapeParser {

    // Конец названия: дальше идут цены и время
    private static final Pattern TITLE_END = Pattern.compile("(?i)\\b(?:vvk|ak|doors?|einlass)\\s*:");

    private final FieldExtractor fieldExtractor;
    private final TemporalParser temporalParser;

    @Override
    public PageShape shape() {
        return PageShape.INLINE_TABLE;
    }

    @Override
    public List<RawFieldSet> parse(Document document, SourceConfig config) {
        Elements containers = fieldExtractor.selectContainers(document, config.getContainerSelectors());
        Elements rows = containers.isEmpty() ? document.select("tr") : containers.select("tr");

        List<RawFieldSet> result = new ArrayList<>();
        for (Element row : rows) {
            try {
                RawFieldSet fields = parseRow(row, config.getBaseUrl());
                if (fields != null) {
                    result.add(fields);
                }
            } catch (ExtractionException e) {
                log.warn("Skipping table row of {}: {}", config.getKey(), e.getMessage());
            }
        }
        log.debug("Inline-table parser found {} rows for {}", result.size(), config.getKey());
        return result;
    }

    RawFieldSet parseRow(Element row, String baseUrl) {
        Elements cells = new Elements();
        for (Element child : row.children()) {
            if ("td".equals(child.normalName())) {
                cells.add(child);
            }
        }
        if (cells.size() < 2) {
            return null;
        }
        String dateCell = cells.get(0).text().trim();
        if (temporalParser.findDate(dateCell).isEmpty()) {
            return null;
        }
        Element main = cells.get(1);
        String text = main.text().trim();

        String title = text;
        Matcher end = TITLE_END.matcher(text);
        if (end.find()) {
            title = text.substring(0, end.start()).trim();
        }
        if (title.isEmpty()) {
            Element strong = main.selectFirst("strong, b, h2, h3");
            title = strong != null ? strong.text().trim() : "";
        }

        RawFieldSet fields = new RawFieldSet();
        fields.setTitle(title.isEmpty() ? null : title);
        fields.setDateText(dateCell);
        fields.setTimeText(temporalParser.parseTime(text));
        fields.setPriceText(text);
        fields.setDescription(text);

        Element link = row.selectFirst("a[href]");
        if (link != null) {
            fields.setDetailUrl(link.absUrl("href").isEmpty() ? null : link.absUrl("href"));
        }
        Element img = row.selectFirst("img");
        if (img != null) {
            fields.setImageUrl(fieldExtractor.imageUrl(img, baseUrl));
        }
        return fields;
    }
}

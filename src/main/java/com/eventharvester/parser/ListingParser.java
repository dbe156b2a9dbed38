package com.eventharvester.parser;

import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a listing document to the parser of its source's shape, then runs detail enrichment.
 */
@Slf4j
@Component
public class ListingParser {

    private final Map<PageShape, ListingShapeParser> parsers = new EnumMap<>(PageShape.class);
    private final ShapeClassifier shapeClassifier;
    private final DetailPageEnricher detailPageEnricher;

    public ListingParser(List<ListingShapeParser> shapeParsers,
                         ShapeClassifier shapeClassifier,
                         DetailPageEnricher detailPageEnricher) {
        for (ListingShapeParser parser : shapeParsers) {
            parsers.put(parser.shape(), parser);
        }
        this.shapeClassifier = shapeClassifier;
        this.detailPageEnricher = detailPageEnricher;
    }

    public PageShape shapeOf(SourceConfig config) {
        return shapeClassifier.classify(config);
    }

    /**
     * @param document   listing page
     * @param config     its source
     * @param listingUrl URL the document was loaded from
     * @return field sets in document order; empty when the page could not be parsed
     */
    public List<RawFieldSet> parse(Document document, SourceConfig config, String listingUrl) {
        PageShape shape = shapeOf(config);
        // Отрендеренная страница разбирается цепочкой селекторов
        ListingShapeParser parser = parsers.get(shape == PageShape.SCRIPT_RENDERED ? PageShape.SELECTOR_CHAIN : shape);

        List<RawFieldSet> fieldSets;
        try {
            fieldSets = parser.parse(document, config);
        } catch (RuntimeException e) {
            log.warn("Failed to parse {} listing {} as {}: {}", config.getKey(), listingUrl, shape, e.getMessage());
            return List.of();
        }

        if (config.isUseDetailPages()) {
            int enriched = 0;
            for (RawFieldSet fields : fieldSets) {
                if (detailPageEnricher.enrich(fields, config, listingUrl)) {
                    enriched++;
                }
            }
            log.debug("Enriched {}/{} entries of {} from detail pages", enriched, fieldSets.size(), config.getKey());
        }
        return fieldSets;
    }
}

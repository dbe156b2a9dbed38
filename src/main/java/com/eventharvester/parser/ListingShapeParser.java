package com.eventharvester.parser;

import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Turns one listing document of a given structural shape into raw field sets.
 */
public interface ListingShapeParser {

    PageShape shape();

    /**
     * @param document fetched listing page
     * @param config   source the page belongs to
     * @return one field set per recognised entry, in document order
     */
    List<RawFieldSet> parse(Document document, SourceConfig config);
}

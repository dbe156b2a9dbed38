package com.eventharvester.collector;

import com.eventharvester.exception.FetchException;
import com.eventharvester.fetch.FetchClient;
import com.eventharvester.fetch.PageLoader;
import com.eventharvester.fetch.RenderedPageLoader;
import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import com.eventharvester.parser.ListingParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fetches every listing page of a source and extracts its entries.
 * <p>
 * Для источников с окнами запрашивается каждое окно по отдельности; сбой одного окна
 * логируется и пропускается, остальные окна обрабатываются. Результаты объединяются
 * до дедупликации.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WindowedCollector {

    private final FetchClient fetchClient;
    private final ListingParser listingParser;
    private final WindowPlanner windowPlanner;
    private final ObjectProvider<RenderedPageLoader> renderedPageLoader;

    public CollectionResult collect(SourceConfig config) {
        PageLoader loader = null;
        if (listingParser.shapeOf(config) == PageShape.SCRIPT_RENDERED) {
            loader = renderedPageLoader.getIfAvailable();
            if (loader == null) {
                log.warn("Skipping {}: listing is script-rendered and no browser loader is enabled "
                        + "(harvester.browser.enabled=true)", config.getKey());
                return CollectionResult.skippedSource();
            }
        }

        CollectionResult result = new CollectionResult();
        if (config.isWindowed()) {
            for (DateWindow window : windowPlanner.plan(config.getWindow())) {
                log.debug("Fetching {} window {} ({} - {})", config.getKey(), window.getIndex(),
                        window.getStart(), window.getEnd());
                collectPage(config, window.getUrl(), loader, result);
            }
        } else {
            for (String url : config.listingUrls()) {
                collectPage(config, url, loader, result);
            }
        }
        log.info("Collected {} raw entries for {} from {} pages ({} failed)", result.getFieldSets().size(),
                config.getKey(), result.getPagesFetched(), result.getPagesFailed());
        return result;
    }

    private void collectPage(SourceConfig config, String url, PageLoader loader, CollectionResult result) {
        Document document;
        try {
            document = loader == null ? fetchClient.fetchWithRetry(url) : fetchClient.fetchWithRetry(url, loader);
        } catch (FetchException e) {
            log.warn("Skipping page {} of {}: {}", url, config.getKey(), e.getMessage());
            result.pageFailed();
            return;
        }
        List<RawFieldSet> page = listingParser.parse(document, config, url);
        result.addPage(page);
    }
}

package com.eventharvester.service;

import com.eventharvester.collector.CollectionResult;
import com.eventharvester.collector.WindowedCollector;
import com.eventharvester.exception.SourceConfigurationException;
import com.eventharvester.model.NormalizedEvent;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import com.eventharvester.parser.EventNormalizer;
import com.eventharvester.publisher.EventPublisher;
import com.eventharvester.publisher.PublishOptions;
import com.eventharvester.publisher.PublishResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the harvest pipeline for one source or for all enabled sources.
 * <p>
 * Сбор -> нормализация -> (фильтр будущих) -> дедупликация -> публикация.
 * Источники обрабатываются последовательно; ошибка одного источника не останавливает остальные.
 */
@Slf4j
@Service
public class HarvestService {

    private final SourceRegistry sourceRegistry;
    private final WindowedCollector collector;
    private final EventNormalizer normalizer;
    private final EventPublisher publisher;
    private final boolean dryRun;
    private final boolean debug;
    private final boolean futureOnly;

    public HarvestService(SourceRegistry sourceRegistry,
                          WindowedCollector collector,
                          EventNormalizer normalizer,
                          EventPublisher publisher,
                          @Value("${harvester.dry-run:false}") boolean dryRun,
                          @Value("${harvester.debug:false}") boolean debug,
                          @Value("${harvester.future-only:true}") boolean futureOnly) {
        this.sourceRegistry = sourceRegistry;
        this.collector = collector;
        this.normalizer = normalizer;
        this.publisher = publisher;
        this.dryRun = dryRun;
        this.debug = debug;
        this.futureOnly = futureOnly;
    }

    /**
     * Harvest every enabled source in turn.
     *
     * @return one report per source that was attempted
     */
    public List<HarvestReport> harvestAll() {
        List<SourceConfig> sources = sourceRegistry.enabled();
        if (sources.isEmpty()) {
            log.warn("No enabled sources. Check harvester.sources and venue-sources.json.");
            return List.of();
        }

        List<HarvestReport> reports = new ArrayList<>();
        for (SourceConfig source : sources) {
            try {
                reports.add(harvest(source));
            } catch (RuntimeException e) {
                log.error("Harvest of {} failed: {}", source.getKey(), e.getMessage(), e);
            }
        }
        logTotals(reports, sources.size());
        return reports;
    }

    public HarvestReport harvest(String sourceKey) {
        SourceConfig source = sourceRegistry.find(sourceKey)
                .orElseThrow(() -> new SourceConfigurationException("Unknown source '" + sourceKey + "'"));
        return harvest(source);
    }

    public HarvestReport harvest(SourceConfig source) {
        if (!source.isEnabled()) {
            log.info("Source {} is disabled, skipping", source.getKey());
            return HarvestReport.skipped(source.getKey());
        }
        log.info("Harvesting {} ({})", source.getVenueName(), source.getKey());

        CollectionResult collected = collector.collect(source);
        if (collected.isSkipped()) {
            return HarvestReport.skipped(source.getKey());
        }

        List<NormalizedEvent> events = new ArrayList<>();
        int discarded = 0;
        for (RawFieldSet raw : collected.getFieldSets()) {
            Optional<NormalizedEvent> event = normalizer.normalize(raw, source);
            if (event.isPresent()) {
                events.add(event.get());
            } else {
                discarded++;
            }
        }

        int pastFiltered = 0;
        if (futureOnly) {
            List<NormalizedEvent> upcoming = normalizer.futureOnly(events);
            pastFiltered = events.size() - upcoming.size();
            events = upcoming;
        }

        Deduplicator deduplicator = new Deduplicator();
        List<NormalizedEvent> unique = deduplicator.deduplicate(events);

        PublishOptions options = PublishOptions.builder()
                .source(source.sourceName())
                .city(source.getCity())
                .dryRun(dryRun)
                .debug(debug)
                .defaultTime(source.getDefaultTime())
                .build();
        PublishResult published = publisher.publish(unique, options);

        HarvestReport report = HarvestReport.builder()
                .source(source.getKey())
                .pagesFetched(collected.getPagesFetched())
                .pagesFailed(collected.getPagesFailed())
                .extracted(collected.getFieldSets().size())
                .discarded(discarded)
                .pastFiltered(pastFiltered)
                .collapsed(deduplicator.getCollapsedCount())
                .published(unique.size())
                .publishResult(published)
                .build();
        log.info("{}: {} extracted, {} without title, {} past, {} duplicates, {} published "
                        + "({} inserted, {} updated, {} failed{})",
                source.getKey(), report.getExtracted(), discarded, pastFiltered, report.getCollapsed(),
                unique.size(), published.getInserted(), published.getUpdated(), published.getFailed(),
                published.isDryRun() ? ", dry run" : "");
        if (published.getLinkSummary() != null) {
            LinkSummary links = published.getLinkSummary();
            log.info("{}: venues linked {}, not found {}, errors {}",
                    source.getKey(), links.getLinked(), links.getNotFound(), links.getErrors());
        }
        return report;
    }

    private void logTotals(List<HarvestReport> reports, int attempted) {
        int extracted = 0;
        int published = 0;
        int failed = 0;
        int skipped = 0;
        for (HarvestReport report : reports) {
            if (report.isSkipped()) {
                skipped++;
                continue;
            }
            extracted += report.getExtracted();
            published += report.getPublished();
            failed += report.getPublishResult().getFailed();
        }
        log.info("Harvest finished: {} sources ({} skipped, {} errored), {} extracted, {} published, {} failed",
                attempted, skipped, attempted - reports.size(), extracted, published, failed);
    }
}

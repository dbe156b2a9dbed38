package com.eventharvester.publisher;

import com.eventharvester.exception.PublishException;
import com.eventharvester.model.Event;
import com.eventharvester.model.NormalizedEvent;
import com.eventharvester.parser.TemporalParser;
import com.eventharvester.repository.EventRepository;
import com.eventharvester.service.VenueLinkService;
import com.eventharvester.util.SlugGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Upserts events straight into the database and links them to the venue registry afterwards.
 * <p>
 * Существующая запись ищется по sourceUrl, иначе по (title, startDateTime);
 * найденная обновляется, иначе создается новая. Ошибка сохранения одной записи учитывается
 * и не прерывает пакет.
 */
@Slf4j
public class DirectStorePublisher implements EventPublisher {

    private final EventRepository eventRepository;
    private final VenueLinkService venueLinkService;
    private final IngestionPayloadMapper mapper;
    private final TemporalParser temporalParser;
    private final DryRunPublisher dryRunPublisher;

    public DirectStorePublisher(EventRepository eventRepository, VenueLinkService venueLinkService,
                                IngestionPayloadMapper mapper, TemporalParser temporalParser) {
        this.eventRepository = eventRepository;
        this.venueLinkService = venueLinkService;
        this.mapper = mapper;
        this.temporalParser = temporalParser;
        this.dryRunPublisher = new DryRunPublisher(mapper);
    }

    @Override
    public PublishResult publish(List<NormalizedEvent> events, PublishOptions options) {
        if (options.isDryRun()) {
            return dryRunPublisher.publish(events, options);
        }

        PublishResult result = new PublishResult();
        for (NormalizedEvent event : events) {
            try {
                if (upsert(event, options)) {
                    result.setInserted(result.getInserted() + 1);
                } else {
                    result.setUpdated(result.getUpdated() + 1);
                }
            } catch (PublishException e) {
                log.warn(e.getMessage());
                result.fail(e.getMessage());
            }
        }
        log.info("Stored events for {}: {} inserted, {} updated, {} failed", options.getSource(),
                result.getInserted(), result.getUpdated(), result.getFailed());

        if (result.getInserted() + result.getUpdated() > 0) {
            result.setLinkSummary(venueLinkService.linkUnlinkedEvents());
        }
        return result;
    }

    /**
     * @return true if a new record was inserted, false if an existing one was updated
     */
    boolean upsert(NormalizedEvent source, PublishOptions options) {
        Instant start = mapper.startInstant(source, options.getDefaultTime());
        try {
            Optional<Event> existing = findExisting(source, start);
            Event event = existing.orElseGet(Event::new);
            apply(source, start, event);
            eventRepository.saveAndFlush(event);
            log.debug("{} '{}' ({})", existing.isPresent() ? "Updated" : "Inserted", event.getTitle(), event.getId());
            return existing.isEmpty();
        } catch (DataAccessException e) {
            throw new PublishException("Failed to store '" + source.getTitle() + "': " + e.getMessage(), e);
        }
    }

    private Optional<Event> findExisting(NormalizedEvent source, Instant start) {
        if (source.getSourceUrl() != null) {
            Optional<Event> bySourceUrl = eventRepository.findFirstBySourceUrl(source.getSourceUrl());
            if (bySourceUrl.isPresent()) {
                return bySourceUrl;
            }
        }
        if (start == null) {
            return Optional.empty();
        }
        return eventRepository.findFirstByTitleAndStartDateTime(source.getTitle(), start);
    }

    private void apply(NormalizedEvent source, Instant start, Event event) {
        event.setTitle(source.getTitle());
        event.setDescription(source.getDescription());
        event.setCategory(source.getCategory());
        event.setSubcategory(source.getSubcategory());
        event.setCity(source.getCity());
        event.setCountry(source.getCountry());
        event.setStartDateTime(start);
        event.setVenueName(source.getVenueName());
        event.setVenueAddress(source.getVenueAddress());
        event.setPriceInfo(source.getPrice());
        event.setFree(temporalParser.isFree(source.getPrice()));
        event.setWebsiteUrl(source.getWebsiteUrl());
        event.setTicketUrl(source.getTicketUrl());
        event.setImageUrl(source.getImageUrl());
        event.setTags(source.getArtists().isEmpty() ? null : String.join(", ", source.getArtists()));
        event.setSource(source.getSource());
        event.setSourceUrl(source.getSourceUrl());
        event.setSlug(SlugGenerator.eventSlug(source.getVenueName(), source.getTitle(), source.getStartDate()));
    }
}

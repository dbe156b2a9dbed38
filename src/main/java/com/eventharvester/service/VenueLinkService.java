package com.eventharvester.service;

import com.eventharvester.model.Event;
import com.eventharvester.model.LinkResult;
import com.eventharvester.model.Venue;
import com.eventharvester.repository.EventRepository;
import com.eventharvester.repository.VenueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Links stored events to the venue registry.
 * <p>
 * Просматриваются только события без venue_id, поэтому повторный запуск безопасен.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VenueLinkService {

    private final EventRepository eventRepository;
    private final VenueRepository venueRepository;

    public LinkSummary linkUnlinkedEvents() {
        Map<VenueKey, Venue> lookup = VenueMatcher.buildLookup(venueRepository.findAll());
        List<Event> unlinked = eventRepository.findByVenueIdIsNullAndVenueNameIsNotNull();
        log.info("Linking {} unlinked events against {} registry venues", unlinked.size(), lookup.size());

        VenueMatcher matcher = new VenueMatcher();
        int linked = 0;
        int errors = 0;
        for (Event event : unlinked) {
            try {
                LinkResult result = matcher.link(event, lookup);
                if (result.isMatched()) {
                    eventRepository.save(event);
                    linked++;
                } else {
                    log.debug("No venue '{}' in {} for event {}", event.getVenueName(), event.getCity(), event.getId());
                }
            } catch (DataAccessException e) {
                errors++;
                log.warn("Failed to link event {}: {}", event.getId(), e.getMessage());
            }
        }

        LinkSummary summary = new LinkSummary(linked, matcher.getUnmatchedCount(), errors);
        log.info("Venue linking finished: {} linked, {} not found, {} errors",
                summary.getLinked(), summary.getNotFound(), summary.getErrors());
        return summary;
    }
}

package com.eventharvester.repository;

import com.eventharvester.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for harvested events.
 * <p>
 * Репозиторий для сохранения и поиска собранных мероприятий.
 */
@Repository
public interface EventRepository extends JpaRepository<Event, Long> {

    /**
     * Existing record with the same event page URL.
     */
    Optional<Event> findFirstBySourceUrl(String sourceUrl);

    /**
     * Fallback match for events whose page URL is unknown.
     */
    Optional<Event> findFirstByTitleAndStartDateTime(String title, Instant startDateTime);

    /**
     * Events not yet linked to the venue registry that carry a venue name to match on.
     * <p>
     * Мероприятия без ссылки на площадку, но с указанным названием площадки.
     */
    List<Event> findByVenueIdIsNullAndVenueNameIsNotNull();
}

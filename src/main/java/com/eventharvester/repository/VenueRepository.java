package com.eventharvester.repository;

import com.eventharvester.model.Venue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to the venue registry. The linker loads the whole registry and matches in memory.
 */
@Repository
public interface VenueRepository extends JpaRepository<Venue, Long> {
}

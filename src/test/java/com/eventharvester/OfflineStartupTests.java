package com.eventharvester;

import com.eventharvester.publisher.EventPublisher;
import com.eventharvester.publisher.RemoteIngestionPublisher;
import com.eventharvester.service.VenueLinkService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Production JPA settings against a database nobody listens on: with the store disabled
 * the harvester must still start and publish through the ingestion endpoint.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:postgresql://127.0.0.1:1/events",
        "spring.datasource.username=postgres",
        "spring.datasource.password=postgres",
        "spring.jpa.database-platform=org.hibernate.dialect.PostgreSQL10Dialect",
        "spring.jpa.hibernate.ddl-auto=none",
        "spring.jpa.properties.hibernate.temp.use_jdbc_metadata_defaults=false",
        "harvester.store.enabled=false",
        "harvester.dry-run=false",
        "harvester.ingestion.url=https://ingest.test/api/events",
        "harvester.ingestion.token=secret"
})
class OfflineStartupTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private EventPublisher eventPublisher;

    @Test
    void testStartsWithoutReachableDatabase() {
        assertTrue(eventPublisher instanceof RemoteIngestionPublisher);
        assertNotNull(context.getBean(VenueLinkService.class));
    }
}

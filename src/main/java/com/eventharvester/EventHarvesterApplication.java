package com.eventharvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Event Harvester.
 * Collects event listings from venue websites, normalizes them and publishes them downstream.
 *
 * Главный класс приложения: собирает афиши площадок, нормализует мероприятия
 * и передает их в хранилище.
 */
@SpringBootApplication
@EnableScheduling // Периодический сбор по расписанию harvester.schedule.cron
public class EventHarvesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventHarvesterApplication.class, args);
    }
}

package com.eventharvester.scheduler;

import com.eventharvester.service.HarvestReport;
import com.eventharvester.service.HarvestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler for periodically harvesting all enabled sources.
 * <p>
 * Запуски не перекрываются: если предыдущий сбор еще идет, очередной запуск пропускается.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HarvestScheduler {

    private final HarvestService harvestService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Cron from {@code harvester.schedule.cron}; by default every day at 06:00 in the venues' zone.
     */
    @Scheduled(cron = "${harvester.schedule.cron:0 0 6 * * *}", zone = "${harvester.zone:Europe/Vienna}")
    public void harvestScheduled() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous harvest still running, skipping this trigger");
            return;
        }
        try {
            log.info("Starting scheduled harvest");
            List<HarvestReport> reports = harvestService.harvestAll();
            log.info("Completed scheduled harvest of {} sources", reports.size());
        } finally {
            running.set(false);
        }
    }

}

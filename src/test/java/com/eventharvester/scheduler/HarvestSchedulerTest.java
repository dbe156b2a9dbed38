package com.eventharvester.scheduler;

import com.eventharvester.service.HarvestService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HarvestSchedulerTest {

    @Test
    void testRunsHarvest() {
        HarvestService harvestService = mock(HarvestService.class);
        when(harvestService.harvestAll()).thenReturn(List.of());

        new HarvestScheduler(harvestService).harvestScheduled();

        verify(harvestService).harvestAll();
    }

    @Test
    void testOverlappingTriggerIsSkipped() throws Exception {
        HarvestService harvestService = mock(HarvestService.class);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(harvestService.harvestAll()).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return List.of();
        });
        HarvestScheduler scheduler = new HarvestScheduler(harvestService);

        Thread first = new Thread(scheduler::harvestScheduled);
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        scheduler.harvestScheduled();
        release.countDown();
        first.join(5000);

        verify(harvestService, times(1)).harvestAll();
    }

    @Test
    void testFailedRunReleasesGuard() {
        HarvestService harvestService = mock(HarvestService.class);
        when(harvestService.harvestAll()).thenThrow(new IllegalStateException("boom")).thenReturn(List.of());
        HarvestScheduler scheduler = new HarvestScheduler(harvestService);

        assertThrows(IllegalStateException.class, scheduler::harvestScheduled);
        scheduler.harvestScheduled();

        verify(harvestService, times(2)).harvestAll();
    }
}

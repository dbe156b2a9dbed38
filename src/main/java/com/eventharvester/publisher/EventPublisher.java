package com.eventharvester.publisher;

import com.eventharvester.model.NormalizedEvent;

import java.util.List;

/**
 * Writes a deduplicated batch of events downstream.
 * <p>
 * Реализация выбирается по наличию настроек: удаленный прием, прямая запись в базу или пробный прогон.
 */
public interface EventPublisher {

    /**
     * @param events  events of one source run
     * @param options run options; {@code dryRun} suppresses every write
     * @return counts of the batch; failures are reported here rather than thrown
     */
    PublishResult publish(List<NormalizedEvent> events, PublishOptions options);
}

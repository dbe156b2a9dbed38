package com.eventharvester.service;

import com.eventharvester.model.NormalizedEvent;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keeps the first occurrence of every event across overlapping fetch windows.
 * <p>
 * Ключ: sourceUrl, если он есть, иначе (нормализованное название, дата начала).
 * Экземпляр создается на один прогон источника. Почти-дубликаты (та же программа с датой,
 * отличающейся из-за вывода года) остаются разными записями.
 */
public class Deduplicator {

    private final Set<String> seenKeys = new HashSet<>();

    @Getter
    private int collapsedCount;

    public List<NormalizedEvent> deduplicate(List<NormalizedEvent> events) {
        List<NormalizedEvent> unique = new ArrayList<>();
        for (NormalizedEvent event : events) {
            if (accept(event)) {
                unique.add(event);
            }
        }
        return unique;
    }

    /**
     * @return true when the event's key has not been seen before in this run
     */
    public boolean accept(NormalizedEvent event) {
        if (seenKeys.add(keyOf(event))) {
            return true;
        }
        collapsedCount++;
        return false;
    }

    static String keyOf(NormalizedEvent event) {
        if (event.getSourceUrl() != null && !event.getSourceUrl().isBlank()) {
            return "url:" + event.getSourceUrl().trim();
        }
        String title = event.getTitle() == null ? ""
                : event.getTitle().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return "title:" + title + "|" + event.getStartDate();
    }
}

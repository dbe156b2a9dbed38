package com.eventharvester.collector;

import com.eventharvester.model.RawFieldSet;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Union of the field sets of every page fetched for one source, with fetch statistics.
 */
@Getter
public class CollectionResult {

    private final List<RawFieldSet> fieldSets = new ArrayList<>();
    private int pagesFetched;
    private int pagesFailed;
    private boolean skipped;

    void addPage(List<RawFieldSet> page) {
        fieldSets.addAll(page);
        pagesFetched++;
    }

    void pageFailed() {
        pagesFailed++;
    }

    static CollectionResult skippedSource() {
        CollectionResult result = new CollectionResult();
        result.skipped = true;
        return result;
    }
}

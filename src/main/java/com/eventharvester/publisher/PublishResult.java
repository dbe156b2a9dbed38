package com.eventharvester.publisher;

import com.eventharvester.service.LinkSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of publishing one batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {

    private int inserted;
    private int updated;
    private int failed;
    private int venuesCreated;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private boolean dryRun;

    /** What would have been sent; filled only on dry runs. */
    @Builder.Default
    private List<IngestionEvent> payload = new ArrayList<>();

    /** Result of the venue linking pass that follows a direct write, if one ran. */
    private LinkSummary linkSummary;

    public void fail(String error) {
        failed++;
        errors.add(error);
    }
}

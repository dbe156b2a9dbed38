package com.eventharvester.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request windowing for listing endpoints that cap the date span per request.
 * <p>
 * {@code urlTemplate} contains {@code {start}} and {@code {end}} placeholders that are replaced
 * with the window bounds formatted by {@code datePattern}.
 */
@Value
@Builder
@Jacksonized
public class WindowSpec {

    String urlTemplate;

    @Builder.Default
    int count = 4;

    @Builder.Default
    int days = 7;

    @Builder.Default
    String datePattern = "yyyy-MM-dd";
}

package com.eventharvester.service;

import lombok.Value;

/**
 * Totals of one venue-linking pass.
 */
@Value
public class LinkSummary {
    int linked;
    int notFound;
    int errors;
}

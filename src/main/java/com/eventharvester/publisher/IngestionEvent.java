package com.eventharvester.publisher;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One event in the body of an ingestion request. Times are ISO-8601 instants in UTC.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionEvent {
    String title;
    String venueName;
    String venueAddress;
    String venueCity;
    String category;
    String startDateTime;
    String endDateTime;
    String price;
    String ticketUrl;
    String websiteUrl;
    String imageUrl;
    String source;
    String sourceUrl;
}

package com.eventharvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Event in the canonical schema, produced exactly once from a {@link RawFieldSet}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedEvent {

    private String title;
    private LocalDate startDate; // null, если дату не удалось разобрать
    private String startTime;    // "HH:MM" или null
    private String venueName;
    private String venueAddress;
    private String city;
    private String country;
    private String category;
    private String subcategory;
    private String price;
    private String description;
    private String imageUrl;
    private String ticketUrl;
    private String websiteUrl;
    private String source;
    private String sourceUrl;

    @Builder.Default
    private List<String> artists = new ArrayList<>();
}

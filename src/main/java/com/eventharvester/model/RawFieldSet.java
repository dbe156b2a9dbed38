package com.eventharvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw, unparsed values extracted from one event entry of a listing document.
 * <p>
 * Сырые значения полей мероприятия, как они найдены на странице. Может быть
 * дополнен не более одного раза данными со страницы подробностей.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFieldSet {

    private String title;
    private String dateText;
    private String timeText;
    private String priceText;
    private String imageUrl;
    private String detailUrl;
    private String ticketUrl;
    private String description;

    @Builder.Default
    private List<String> artists = new ArrayList<>();

    private boolean enriched; // true после обогащения со страницы подробностей
}

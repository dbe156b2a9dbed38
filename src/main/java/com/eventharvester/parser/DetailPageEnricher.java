package com.eventharvester.parser;

import com.eventharvester.exception.FetchException;
import com.eventharvester.fetch.FetchClient;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Second pass over an event's own page to fill in what the listing card lacked.
 * <p>
 * Уже заполненные скалярные поля (название, дата, время, цена, билеты) не перезаписываются;
 * описание, состав и картинка заменяются, только если новое значение богаче.
 * Ошибка загрузки оставляет событие с данными из списка.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetailPageEnricher {

    // "-300x200" перед расширением файла - миниатюра WordPress
    private static final Pattern SIZE_SUFFIX = Pattern.compile("-\\d+x\\d+(?=\\.[a-zA-Z]{3,4}(?:\\?.*)?$)");

    private final FetchClient fetchClient;
    private final FieldExtractor fieldExtractor;
    private final TemporalParser temporalParser;

    /**
     * @return true when a detail document was fetched and merged
     */
    public boolean enrich(RawFieldSet fields, SourceConfig config, String listingUrl) {
        String detailUrl = fields.getDetailUrl();
        if (!config.isUseDetailPages() || fields.isEnriched() || detailUrl == null
                || detailUrl.equals(listingUrl) || config.isListingUrl(detailUrl)) {
            return false;
        }
        // Не более одного обогащения на событие, даже если загрузка не удалась
        fields.setEnriched(true);

        Document document;
        try {
            document = fetchClient.fetchWithRetry(detailUrl);
        } catch (FetchException e) {
            log.warn("Detail page unavailable for '{}' ({}): {}", fields.getTitle(), detailUrl, e.getMessage());
            return false;
        }

        try {
            RawFieldSet detail = fieldExtractor.extractFields(document, config::detailSelectorsFor, config.getBaseUrl());
            merge(fields, detail);
            if (fields.getTimeText() == null && document.body() != null) {
                fields.setTimeText(temporalParser.parseTime(document.body().text()));
            }
        } catch (RuntimeException e) {
            log.warn("Could not enrich '{}' from {}: {}", fields.getTitle(), detailUrl, e.getMessage());
            return false;
        }
        return true;
    }

    void merge(RawFieldSet target, RawFieldSet detail) {
        if (target.getTitle() == null) target.setTitle(detail.getTitle());
        if (target.getDateText() == null) target.setDateText(detail.getDateText());
        if (target.getTimeText() == null) target.setTimeText(detail.getTimeText());
        if (target.getPriceText() == null) target.setPriceText(detail.getPriceText());
        if (target.getTicketUrl() == null) target.setTicketUrl(detail.getTicketUrl());

        String description = detail.getDescription();
        if (description != null && (target.getDescription() == null
                || description.length() > target.getDescription().length())) {
            target.setDescription(description);
        }

        if (detail.getArtists().size() > target.getArtists().size()) {
            target.setArtists(detail.getArtists());
        }

        String image = detail.getImageUrl();
        if (image != null && (target.getImageUrl() == null || !isThumbnail(image))) {
            target.setImageUrl(fullResolution(image));
        }
    }

    static boolean isThumbnail(String imageUrl) {
        return imageUrl.toLowerCase(Locale.ROOT).contains("thumb");
    }

    /**
     * Strip a "-WxH" size suffix to reach the original upload.
     */
    static String fullResolution(String imageUrl) {
        return SIZE_SUFFIX.matcher(imageUrl).replaceFirst("");
    }
}

package com.eventharvester.util;

import java.text.Normalizer;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Генерация URL-совместимых идентификаторов (slug) для площадок и мероприятий.
 */
public final class SlugGenerator {

    private static final int MAX_SLUG_LENGTH = 200;

    private SlugGenerator() {
    }

    /**
     * Converts free text into a lower-case, hyphen separated slug.
     * German umlauts are transliterated, other diacritics are dropped.
     *
     * @param text text to convert, may be null
     * @return the slug, empty for blank input
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String slug = text.toLowerCase(Locale.ROOT).trim()
                .replace("ä", "ae")
                .replace("ö", "oe")
                .replace("ü", "ue")
                .replace("ß", "ss");
        slug = Normalizer.normalize(slug, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        slug = slug.replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("[\\s_-]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug;
    }

    /**
     * Builds the event slug {@code venueSlug-titleSlug[-yyyy-MM-dd]}, cut at 200 characters.
     */
    public static String eventSlug(String venueName, String title, LocalDate date) {
        String venueSlug = slugify(venueName);
        String titleSlug = slugify(title);

        StringBuilder slug = new StringBuilder(venueSlug);
        if (!titleSlug.isEmpty()) {
            slug.append('-').append(titleSlug);
        }
        if (date != null) {
            slug.append('-').append(date);
        } else if (titleSlug.isEmpty()) {
            slug.append("-event");
        }

        String result = slug.toString().replaceAll("-+", "-").replaceAll("^-", "");
        return result.length() > MAX_SLUG_LENGTH ? result.substring(0, MAX_SLUG_LENGTH) : result;
    }
}

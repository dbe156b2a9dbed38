package com.eventharvester.parser;

import com.eventharvester.exception.ExtractionException;
import com.eventharvester.model.EventField;
import com.eventharvester.model.PageShape;
import com.eventharvester.model.RawFieldSet;
import com.eventharvester.model.SourceConfig;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Selector-chain extraction of event cards.
 * <p>
 * Двухуровневый перебор селекторов: сначала контейнеры карточек (побеждает первый селектор,
 * давший хотя бы одно совпадение), затем для каждого поля карточки - первый непустой результат
 * из списка кандидатов.
 */
@Slf4j
@Component
public class FieldExtractor implements ListingShapeParser {

    @Override
    public PageShape shape() {
        return PageShape.SELECTOR_CHAIN;
    }

    @Override
    public List<RawFieldSet> parse(Document document, SourceConfig config) {
        Elements cards = selectContainers(document, config.getContainerSelectors());
        if (cards.isEmpty()) {
            log.info("No event containers found for {} ({})", config.getKey(), document.location());
            return List.of();
        }
        log.debug("Found {} event containers for {}", cards.size(), config.getKey());

        List<RawFieldSet> result = new ArrayList<>();
        for (Element card : cards) {
            try {
                result.add(extractFields(card, config::selectorsFor, config.getBaseUrl()));
            } catch (RuntimeException e) {
                // Ошибка в одной карточке не должна прерывать обработку остальных
                log.warn("Skipping card of {}: {}", config.getKey(), e.getMessage());
            }
        }
        return result;
    }

    /**
     * First container selector with at least one match wins; later selectors are not unioned in.
     */
    public Elements selectContainers(Element root, List<String> containerSelectors) {
        for (String selector : containerSelectors) {
            Elements found = selectSafely(root, selector);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return new Elements();
    }

    /**
     * Extract every logical field below {@code root}.
     *
     * @param root      card element (or a whole detail document)
     * @param selectors candidate selectors per field
     * @param baseUrl   fallback base for relative URLs when the document has no base URI
     */
    public RawFieldSet extractFields(Element root, Function<EventField, List<String>> selectors, String baseUrl) {
        RawFieldSet fields = new RawFieldSet();

        fields.setTitle(field(EventField.TITLE, () -> firstText(root, selectors.apply(EventField.TITLE))));
        fields.setDateText(field(EventField.DATE, () -> firstDateText(root, selectors.apply(EventField.DATE))));
        fields.setTimeText(field(EventField.TIME, () -> firstText(root, selectors.apply(EventField.TIME))));
        fields.setPriceText(field(EventField.PRICE, () -> firstText(root, selectors.apply(EventField.PRICE))));
        fields.setDescription(field(EventField.DESCRIPTION,
                () -> firstText(root, selectors.apply(EventField.DESCRIPTION))));
        fields.setDetailUrl(field(EventField.LINK, () -> firstLink(root, selectors.apply(EventField.LINK), baseUrl)));
        fields.setTicketUrl(field(EventField.TICKET,
                () -> firstUrl(root, selectors.apply(EventField.TICKET), "href", baseUrl)));
        fields.setImageUrl(field(EventField.IMAGE, () -> firstImage(root, selectors.apply(EventField.IMAGE), baseUrl)));

        List<String> artists = field(EventField.ARTISTS, () -> allTexts(root, selectors.apply(EventField.ARTISTS)));
        if (artists != null) {
            fields.setArtists(artists);
        }

        // Запасной вариант заголовка: alt/title первой картинки карточки
        if (isBlank(fields.getTitle())) {
            Element img = root.selectFirst("img");
            if (img != null) {
                String alt = img.attr("alt").isBlank() ? img.attr("title") : img.attr("alt");
                fields.setTitle(alt.isBlank() ? null : alt.trim());
            }
        }
        return fields;
    }

    private <T> T field(EventField field, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (ExtractionException e) {
            log.debug("Field {} treated as absent: {}", field.key(), e.getMessage());
            return null;
        }
    }

    String firstText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element element = firstMatch(root, selector);
            if (element != null) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private String firstDateText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element element = firstMatch(root, selector);
            if (element == null) {
                continue;
            }
            // <time datetime="2025-11-26T22:00"> надежнее видимого текста
            if (element.hasAttr("datetime") && !element.attr("datetime").isBlank()) {
                return element.attr("datetime").trim();
            }
            String text = element.text().trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private String firstLink(Element root, List<String> selectors, String baseUrl) {
        String url = firstUrl(root, selectors, "href", baseUrl);
        if (url == null && "a".equals(root.normalName()) && root.hasAttr("href")) {
            url = absolute(root, "href", baseUrl);
        }
        return url;
    }

    private String firstUrl(Element root, List<String> selectors, String attribute, String baseUrl) {
        for (String selector : selectors) {
            Element element = firstMatch(root, selector);
            if (element == null) {
                continue;
            }
            Element target = element.hasAttr(attribute) ? element : element.selectFirst("[" + attribute + "]");
            if (target != null) {
                String url = absolute(target, attribute, baseUrl);
                if (url != null) {
                    return url;
                }
            }
        }
        return null;
    }

    private String firstImage(Element root, List<String> selectors, String baseUrl) {
        for (String selector : selectors) {
            Element element = firstMatch(root, selector);
            if (element == null) {
                continue;
            }
            Element img = isImageLike(element) ? element : element.selectFirst("img");
            if (img != null) {
                String url = imageUrl(img, baseUrl);
                if (url != null) {
                    return url;
                }
            }
        }
        return null;
    }

    /**
     * Image source in order of preference: src, data-src, largest srcset candidate.
     */
    String imageUrl(Element img, String baseUrl) {
        String src = absolute(img, "src", baseUrl);
        if (src != null && !src.startsWith("data:")) {
            return src;
        }
        String dataSrc = absolute(img, "data-src", baseUrl);
        if (dataSrc != null) {
            return dataSrc;
        }
        String srcset = img.hasAttr("srcset") ? img.attr("srcset") : img.attr("data-srcset");
        String largest = largestSrcsetCandidate(srcset);
        return largest == null ? null : resolve(img.baseUri(), baseUrl, largest);
    }

    static String largestSrcsetCandidate(String srcset) {
        if (srcset == null || srcset.isBlank()) {
            return null;
        }
        String best = null;
        long bestWidth = -1;
        for (String candidate : srcset.split(",")) {
            String[] parts = candidate.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }
            long width = 0;
            // ширина длиннее 18 цифр не помещается в long и считается неизвестной
            if (parts.length > 1 && parts[1].matches("\\d{1,18}w")) {
                width = Long.parseLong(parts[1].substring(0, parts[1].length() - 1));
            }
            if (width > bestWidth) {
                bestWidth = width;
                best = parts[0];
            }
        }
        return best;
    }

    private List<String> allTexts(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Elements found = selectSafely(root, selector);
            if (found.isEmpty()) {
                continue;
            }
            List<String> texts = new ArrayList<>();
            for (Element element : found) {
                String text = element.text().trim();
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            }
            if (!texts.isEmpty()) {
                return texts;
            }
        }
        return null;
    }

    private Element firstMatch(Element root, String selector) {
        Elements found = selectSafely(root, selector);
        return found.isEmpty() ? null : found.first();
    }

    private Elements selectSafely(Element root, String selector) {
        try {
            return root.select(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            // jsoup сообщает о несбалансированных скобках через IllegalArgumentException
            throw new ExtractionException("Invalid selector '" + selector + "'", e);
        }
    }

    private static boolean isImageLike(Element element) {
        return "img".equals(element.normalName()) || "source".equals(element.normalName());
    }

    private static String absolute(Element element, String attribute, String baseUrl) {
        String raw = element.attr(attribute).trim();
        if (raw.isEmpty()) {
            return null;
        }
        String abs = element.absUrl(attribute);
        if (!abs.isEmpty()) {
            return abs;
        }
        return resolve(element.baseUri(), baseUrl, raw);
    }

    private static String resolve(String documentBase, String baseUrl, String raw) {
        String base = documentBase != null && !documentBase.isBlank() ? documentBase : baseUrl;
        if (base == null || base.isBlank()) {
            return raw;
        }
        try {
            return URI.create(base).resolve(raw.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Cannot resolve URL '" + raw + "' against " + base, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

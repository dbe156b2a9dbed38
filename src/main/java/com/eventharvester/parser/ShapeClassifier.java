package com.eventharvester.parser;

import com.eventharvester.model.PageShape;
import com.eventharvester.model.SourceConfig;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Static classification of sources into listing shapes.
 * <p>
 * Таблица составлена вручную по структуре страниц площадок; она не проверяет HTML
 * и может устареть после редизайна сайта. Явное поле shape в конфигурации источника имеет приоритет.
 */
@Component
public class ShapeClassifier {

    private static final Map<String, PageShape> SHAPES = Map.ofEntries(
            Map.entry("celeste", PageShape.PIPE_DELIMITED),
            Map.entry("chelsea", PageShape.INLINE_TABLE),
            Map.entry("grelle-forelle", PageShape.PLAIN_TEXT),
            Map.entry("das-werk", PageShape.PLAIN_TEXT),
            Map.entry("b72", PageShape.PLAIN_TEXT),
            Map.entry("sass-music-club", PageShape.PLAIN_TEXT),
            Map.entry("the-loft", PageShape.PLAIN_TEXT),
            Map.entry("rhiz", PageShape.PLAIN_TEXT),
            Map.entry("flex", PageShape.SCRIPT_RENDERED),
            Map.entry("u4", PageShape.SCRIPT_RENDERED),
            Map.entry("o-der-klub", PageShape.SCRIPT_RENDERED),
            Map.entry("prater-dome", PageShape.SCRIPT_RENDERED),
            Map.entry("praterstrasse", PageShape.SCRIPT_RENDERED),
            Map.entry("flucc", PageShape.SCRIPT_RENDERED)
    );

    public PageShape classify(SourceConfig config) {
        if (config.getShape() != null) {
            return config.getShape();
        }
        return SHAPES.getOrDefault(config.getKey(), PageShape.SELECTOR_CHAIN);
    }
}

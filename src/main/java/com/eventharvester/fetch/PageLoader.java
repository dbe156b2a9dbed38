package com.eventharvester.fetch;

import com.eventharvester.exception.FetchException;
import org.jsoup.nodes.Document;

/**
 * Loads a single URL into a parsed document.
 * <p>
 * Загрузчик страницы. Ограничение частоты запросов и повторы выполняет {@link FetchClient},
 * реализация отвечает только за один запрос.
 */
public interface PageLoader {

    /**
     * @param url absolute page URL
     * @return the parsed document with its base URI set to the loaded URL
     * @throws FetchException on non-2xx status, timeout or connection failure
     */
    Document load(String url) throws FetchException;
}

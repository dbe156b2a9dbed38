package com.eventharvester.fetch;

import com.eventharvester.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * Plain HTTP page loader based on Jsoup.
 * <p>
 * Загружает HTML-страницу через Jsoup с браузерным User-Agent и заголовками Accept.
 */
@Slf4j
@Primary
@Component
public class JsoupPageLoader implements PageLoader {

    private final int timeout; // Таймаут запроса в миллисекундах
    private final String userAgent;

    public JsoupPageLoader(@Value("${harvester.fetch.timeout-ms:30000}") int timeout,
                           @Value("${harvester.fetch.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36}") String userAgent) {
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public Document load(String url) throws FetchException {
        log.debug("GET {}", url);
        try {
            return Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeout)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "de-AT,de;q=0.9,en-US;q=0.8,en;q=0.7")
                    .header("Connection", "keep-alive")
                    .get();
        } catch (HttpStatusException e) {
            // Ответ не 2xx: сохраняем статус для логов и решения о повторе
            throw new FetchException(url, e.getStatusCode(), "HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(url, "Timed out after " + timeout + " ms: " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new FetchException(url, "Failed to load " + url + ": " + e.getMessage(), e);
        }
    }
}

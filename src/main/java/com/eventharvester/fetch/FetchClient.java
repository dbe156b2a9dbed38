package com.eventharvester.fetch;

import com.eventharvester.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Rate-limited document retrieval with exponential-backoff retry.
 * <p>
 * Перед каждым запросом к одному и тому же источнику (scheme + host + port) выдерживается
 * минимальная пауза; неудачные попытки повторяются с задержкой baseDelay * 2^(attempt-1).
 */
@Slf4j
@Component
public class FetchClient {

    private final PageLoader pageLoader;
    private final Sleeper sleeper;
    private final Clock clock;
    private final long minDelayMs;
    private final int maxAttempts;
    private final long baseDelayMs;

    // Время последнего запроса к каждому origin, мс
    private final Map<String, Long> lastCallByOrigin = new HashMap<>();

    public FetchClient(PageLoader pageLoader,
                       Sleeper sleeper,
                       Clock clock,
                       @Value("${harvester.fetch.min-delay-ms:2000}") long minDelayMs,
                       @Value("${harvester.fetch.max-attempts:3}") int maxAttempts,
                       @Value("${harvester.fetch.base-delay-ms:1000}") long baseDelayMs) {
        this.pageLoader = pageLoader;
        this.sleeper = sleeper;
        this.clock = clock;
        this.minDelayMs = minDelayMs;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = baseDelayMs;
    }

    /**
     * Single attempt through the default loader.
     */
    public Document fetch(String url) throws FetchException {
        return fetch(url, pageLoader);
    }

    /**
     * Single attempt through the given loader, preceded by the per-origin delay.
     */
    public Document fetch(String url, PageLoader loader) throws FetchException {
        throttle(url);
        return loader.load(url);
    }

    public Document fetchWithRetry(String url) throws FetchException {
        return fetchWithRetry(url, pageLoader, maxAttempts, baseDelayMs);
    }

    public Document fetchWithRetry(String url, PageLoader loader) throws FetchException {
        return fetchWithRetry(url, loader, maxAttempts, baseDelayMs);
    }

    public Document fetchWithRetry(String url, int maxAttempts, long baseDelayMs) throws FetchException {
        return fetchWithRetry(url, pageLoader, maxAttempts, baseDelayMs);
    }

    /**
     * Fetch with retry.
     *
     * @param url         page URL
     * @param loader      loader to route the request through
     * @param maxAttempts total number of attempts, at least one
     * @param baseDelayMs delay after the first failed attempt; doubled after each further failure
     * @return the document of the first successful attempt
     * @throws FetchException the error of the last attempt once all attempts failed
     */
    public Document fetchWithRetry(String url, PageLoader loader, int maxAttempts, long baseDelayMs)
            throws FetchException {
        int attempts = Math.max(1, maxAttempts);
        FetchException lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return fetch(url, loader);
            } catch (FetchException e) {
                lastError = e;
                if (attempt == attempts) {
                    break;
                }
                long delay = baseDelayMs * (1L << (attempt - 1));
                log.warn("Attempt {}/{} failed for {}: {}. Retrying in {} ms",
                        attempt, attempts, url, e.getMessage(), delay);
                pause(url, delay);
            }
        }

        log.warn("Giving up on {} after {} attempts", url, attempts);
        throw lastError;
    }

    private void throttle(String url) throws FetchException {
        String origin = originOf(url);
        Long lastCall = lastCallByOrigin.get(origin);
        if (lastCall != null) {
            long wait = minDelayMs - (clock.millis() - lastCall);
            if (wait > 0) {
                log.debug("Waiting {} ms before next request to {}", wait, origin);
                pause(url, wait);
            }
        }
        lastCallByOrigin.put(origin, clock.millis());
    }

    private void pause(String url, long millis) throws FetchException {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, "Interrupted while waiting to fetch " + url, e);
        }
    }

    static String originOf(String url) throws FetchException {
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null) {
                throw new FetchException(url, "Not an absolute URL: " + url);
            }
            String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
            int port = uri.getPort();
            if (port == -1) {
                port = "https".equals(scheme) ? 443 : 80;
            }
            return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + ":" + port;
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Malformed URL: " + url, e);
        }
    }
}

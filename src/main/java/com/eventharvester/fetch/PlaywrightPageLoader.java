package com.eventharvester.fetch;

import com.eventharvester.exception.FetchException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;

/**
 * Headless Chromium loader for script-rendered listings. Enabled with {@code harvester.browser.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "harvester.browser.enabled", havingValue = "true")
public class PlaywrightPageLoader implements RenderedPageLoader {

    private final int timeout;
    private final String userAgent;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;

    public PlaywrightPageLoader(@Value("${harvester.fetch.timeout-ms:30000}") int timeout,
                                @Value("${harvester.fetch.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36}") String userAgent) {
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @PostConstruct
    void start() {
        playwright = Playwright.create();
        browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
        context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(userAgent)
                .setLocale("de-AT")
                .setTimezoneId("Europe/Vienna"));
        log.info("Headless browser launched for rendered listings");
    }

    @PreDestroy
    void stop() {
        if (context != null) context.close();
        if (browser != null) browser.close();
        if (playwright != null) playwright.close();
    }

    @Override
    public synchronized Document load(String url) throws FetchException {
        log.debug("RENDER {}", url);
        try (Page page = context.newPage()) {
            Response response = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(timeout));
            if (response != null && !response.ok()) {
                throw new FetchException(url, response.status(), "HTTP " + response.status() + " for " + url, null);
            }
            return Jsoup.parse(page.content(), page.url());
        } catch (PlaywrightException e) {
            throw new FetchException(url, "Rendering failed for " + url + ": " + e.getMessage(), e);
        }
    }
}

package com.eventharvester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Конфигурация бина RestTemplate для вызовов сервиса приема мероприятий.
 */
@Configuration
public class RestTemplateConfig {

    /**
     * @param timeoutMs таймаут соединения и чтения, общий с загрузкой страниц
     * @return настроенный RestTemplate
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${harvester.fetch.timeout-ms:30000}") long timeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }
}

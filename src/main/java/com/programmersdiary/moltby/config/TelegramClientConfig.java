package com.programmersdiary.moltby.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Bounds every Bot API call so a stalled connection fails the send instead of
 * holding a dispatch thread.
 */
@Configuration
public class TelegramClientConfig {

    @Bean
    public RestClientCustomizer telegramTimeouts(
            @Value("${moltby.telegram.connect-timeout:10s}") Duration connectTimeout,
            @Value("${moltby.telegram.read-timeout:30s}") Duration readTimeout) {
        var requestFactory = requestFactory(connectTimeout, readTimeout);
        return builder -> builder.requestFactory(requestFactory);
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return factory;
    }
}

package com.xksgroup.downloadtracker.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ClientConfig {

    @Bean
    public OkHttpClient okHttpClient(
            @Value("${tracker.http.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${tracker.http.read-timeout-seconds:30}") long readTimeoutSeconds
    ) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .readTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .callTimeout(Duration.ofSeconds(connectTimeoutSeconds + readTimeoutSeconds))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

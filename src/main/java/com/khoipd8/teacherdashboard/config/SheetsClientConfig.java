package com.khoipd8.teacherdashboard.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SheetsClientConfig {

    @Bean
    public RestTemplate sheetsRestTemplate(RestTemplateBuilder builder, SheetsProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean(name = "tableFetchExecutor")
    public ThreadPoolTaskExecutor tableFetchExecutor(DashboardProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchPoolSize());
        executor.setMaxPoolSize(properties.getFetchPoolSize());
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("sheet-fetch-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock dashboardClock(DashboardProperties properties) {
        String zone = properties.getZoneId();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone));
    }
}

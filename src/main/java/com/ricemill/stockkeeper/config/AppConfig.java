package com.ricemill.stockkeeper.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppConfig {

    /**
     * Decides what "today" is for period resolution and movement date checks.
     */
    @Bean
    public Clock clock(@Value("${stockkeeper.timezone:UTC}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }

    // Delivers change notifications off the writer's thread
    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor() {
        return Executors.newFixedThreadPool(2);
    }
}

package com.cronpilot.engine;

import com.cronpilot.engine.config.CronProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Instant;

/**
 * Beans that @DataJpaTest slices need besides the JPA layer: a clock the
 * test controls, a fake executor, an in-memory meter registry and the
 * cronpilot properties from the test application.yml.
 */
@TestConfiguration
@EnableConfigurationProperties(CronProperties.class)
public class EngineTestConfig {

    public static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    @Bean
    MutableClock clock() {
        return new MutableClock(START);
    }

    @Bean
    FakeGraphExecutor graphExecutor() {
        return new FakeGraphExecutor();
    }

    @Bean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}

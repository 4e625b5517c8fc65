package com.example.accountscheduler;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

@TestConfiguration(proxyBeanMethods = false)
public class TestcontainersConfiguration {

    public static final Instant START = Instant.parse("2026-01-05T04:00:00Z");

    @Bean
    @ServiceConnection
    PostgreSQLContainer<?> postgresContainer() {
        return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));
    }

    @Bean
    @Primary
    MutableClock mutableClock() {
        return new MutableClock(START);
    }
}

package com.example.accountscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Automation service connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.automation-service")
public class AutomationServiceProperties {
    @NotBlank
    private String baseUrl;
    @Min(1)
    private int timeoutSeconds = 120;
}

package com.lineguard.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the polling and reference-sync jobs. Off under the lambda profile,
 * where cycles are triggered externally, and under the test profile.
 */
@Configuration
@EnableScheduling
@Profile("!lambda & !test")
public class SchedulingConfig {
}

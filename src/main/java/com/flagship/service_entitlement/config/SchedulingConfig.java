package com.flagship.service_entitlement.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the outbox publisher, hold expiry sweep, ledger archive job and
 * metrics refresh. Each job has its own enable flag.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}

package com.flagship.pharmacy_pos.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} on the service facades. Only transient store
 * conflicts (busy rows, serialization failures) are retried there.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}

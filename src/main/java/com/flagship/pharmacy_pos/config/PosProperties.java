package com.flagship.pharmacy_pos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Tunables for the terminal session engine and its price/account variants.
 * Defaults match the behaviour the stores run with today.
 */
@Data
@ConfigurationProperties(prefix = "pos")
public class PosProperties {

    private Session session = new Session();
    private Authorization authorization = new Authorization();
    private Pricing pricing = new Pricing();
    private AccountLock accountLock = new AccountLock();

    @Data
    public static class Session {
        private int forceCloseMinJustification = 10;
        /** Sessions open longer than this are closed by the stale-session sweeper. */
        private Duration staleAfter = Duration.ofHours(24);
        /** Diagnostics flag open sessions older than this as suspicious. */
        private Duration suspiciousAfter = Duration.ofHours(12);
    }

    @Data
    public static class Authorization {
        private int pinMinLength = 4;
        private int pinMaxLength = 8;
        private int maxAttempts = 5;
        private Duration window = Duration.ofMinutes(5);
        private Duration lockout = Duration.ofMinutes(15);
        private boolean redisEnabled = true;
    }

    @Data
    public static class Pricing {
        private BigDecimal approvalThreshold = new BigDecimal("0.20");
        private int minReasonLength = 10;
    }

    @Data
    public static class AccountLock {
        private int temporaryThreshold = 5;
        private Duration temporaryDuration = Duration.ofMinutes(15);
        private int permanentThreshold = 10;
    }
}

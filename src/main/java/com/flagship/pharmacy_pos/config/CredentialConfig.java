package com.flagship.pharmacy_pos.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class CredentialConfig {

    /**
     * Encoder for supervisor and cashier PINs. Strength 10 keeps a PIN
     * check under ~100ms, which matters because authorization scans every
     * eligible principal.
     */
    @Bean
    public PasswordEncoder pinEncoder() {
        return new BCryptPasswordEncoder(10);
    }
}

package com.flagship.token_ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson configuration for JSON serialization.
 *
 * Key features:
 * - Java 8 date/time support (transfer timestamps are Instants)
 * - ISO-8601 date format (not timestamps)
 * - Fractional numbers are rejected for integer fields (token amounts)
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Register Java 8 date/time module
        mapper.registerModule(new JavaTimeModule());

        // Use ISO-8601 format for dates
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Amounts are whole base units: 7.9 must not be truncated to 7
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

        return mapper;
    }
}

package com.structcheck.verification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.structcheck.common.verification.SlendernessMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VerificationConfig {

    @Value("${verification.curve.sample-points:50}")
    private int samplePoints;

    @Value("${verification.slenderness.default-mode:MAGNIFY_DEMAND}")
    private SlendernessMode defaultMode;

    @Value("${verification.batch.parallelism:4}")
    private int batchParallelism;

    @Bean
    public VerificationSettings verificationSettings() {
        return new VerificationSettings(samplePoints, defaultMode, batchParallelism);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

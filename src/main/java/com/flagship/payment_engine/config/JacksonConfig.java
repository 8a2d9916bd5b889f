package com.flagship.payment_engine.config;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson configuration for the JSON account output.
 *
 * Key features:
 * - BigDecimal written in plain notation, never scientific
 * - Optional pretty printing (engine.output.json.pretty)
 */
@Configuration
public class JacksonConfig {

    @Value("${engine.output.json.pretty:false}")
    private boolean prettyPrint;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        JsonMapper mapper = JsonMapper.builder()
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();

        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }

        return mapper;
    }
}

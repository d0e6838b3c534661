package dev.devanks.propcast.coordinator.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;

import java.util.stream.Collectors;

/**
 * Feign decodes with servlet-style message converters, which Spring Boot does not register in a WebFlux application.
 */
@Configuration
public class FeignMessageConverterConfig {

    @Bean
    @ConditionalOnMissingBean
    public HttpMessageConverters feignHttpMessageConverters(ObjectProvider<HttpMessageConverter<?>> converters) {
        return new HttpMessageConverters(converters.orderedStream().collect(Collectors.toList()));
    }
}

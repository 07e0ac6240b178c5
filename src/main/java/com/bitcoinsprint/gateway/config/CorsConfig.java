package com.bitcoinsprint.gateway.config;

import com.bitcoinsprint.gateway.web.GatewayFilterOrder;
import com.bitcoinsprint.gateway.web.RequestContextKeys;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS as a stage of the filter chain, ahead of authentication so preflight requests
 * are answered without a key.
 */
@Configuration
public class CorsConfig {

    @Bean
    FilterRegistrationBean<CorsFilter> corsFilter(GatewayProperties props) {
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(props.getCors().getAllowedOrigins());
        c.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        c.setAllowedHeaders(List.of("*"));
        c.setExposedHeaders(List.of(
                HttpHeaders.RETRY_AFTER,
                RequestContextKeys.CORRELATION_ID_HEADER,
                RequestContextKeys.RATE_LIMIT_LIMIT_HEADER,
                RequestContextKeys.RATE_LIMIT_REMAINING_HEADER
        ));
        c.setAllowCredentials(false);
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);

        FilterRegistrationBean<CorsFilter> registration = new FilterRegistrationBean<>(new CorsFilter(src));
        registration.setOrder(GatewayFilterOrder.CORS);
        return registration;
    }
}

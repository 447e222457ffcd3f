package org.tanzu.azureagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

/**
 * Opens the HTTP surface to browser-based chat front ends.
 */
@Configuration
public class CorsConfig {

    private static final Logger logger = LoggerFactory.getLogger(CorsConfig.class);

    @Bean
    public CorsWebFilter corsWebFilter(AgentProperties agentProperties) {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(agentProperties.getCors().getAllowedOrigins());
        cors.addAllowedMethod("*");
        cors.addAllowedHeader("*");
        cors.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);
        logger.info("CORS enabled for origins {}", agentProperties.getCors().getAllowedOrigins());
        return new CorsWebFilter(source);
    }
}

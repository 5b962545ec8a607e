package org.example.biolearn.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(ContentApiProperties.class)
public class ContentWebConfig implements WebMvcConfigurer {

    private final ContentApiProperties properties;

    public ContentWebConfig(ContentApiProperties properties) {
        this.properties = properties;
    }

    // Origin patterns rather than origins: a literal "*" origin cannot be combined with credentials.
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        ContentApiProperties.Cors cors = properties.getCors();
        registry.addMapping("/**")
                .allowedOriginPatterns(cors.getAllowedOriginPatterns().toArray(String[]::new))
                .allowedMethods("*")
                .allowedHeaders("*")
                .exposedHeaders(RequestCorrelation.HEADER_NAME)
                .allowCredentials(cors.isAllowCredentials());
    }
}

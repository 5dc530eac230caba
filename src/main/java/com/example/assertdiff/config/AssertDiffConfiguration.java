package com.example.assertdiff.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

@Configuration
@ComponentScan("com.example.assertdiff")
@PropertySource("classpath:assert-diff.properties")
public class AssertDiffConfiguration {

    @Bean
    public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public DisplaySettings displaySettings(
            @Value("${assertdiff.max-line-length:78}") int maxLineLength,
            @Value("${assertdiff.diff-context-size:3}") int diffContextSize) {
        return new DisplaySettings(maxLineLength, Math.max(0, diffContextSize));
    }
}

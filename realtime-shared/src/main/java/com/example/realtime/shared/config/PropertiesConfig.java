package com.example.realtime.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:realtime-stream-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "realtime")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // realtime.pod-name, when set, overrides this during binding
        properties.setPodName(podName);
        return properties;
    }
}

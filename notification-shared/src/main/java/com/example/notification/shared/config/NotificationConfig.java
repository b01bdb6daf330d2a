package com.example.notification.shared.config;

import com.example.notification.shared.mapper.NotificationPayloadMapper;
import com.example.notification.shared.service.NotificationFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties
@ComponentScan(basePackageClasses = {NotificationFactory.class, NotificationPayloadMapper.class})
public class NotificationConfig {

    @Bean
    @ConfigurationProperties(prefix = "notification")
    public AppProperties appProperties() {
        return new AppProperties();
    }
}

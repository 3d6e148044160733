package com.hostelgate.backend.modules.leave.infrastructure.sms;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class SmsConfig {

    @Bean
    public SmsGateway smsGateway(SmsProperties properties, RestTemplateBuilder restTemplateBuilder) {
        if (!properties.enabled()) {
            return new LoggingSmsGateway();
        }
        RestTemplate restTemplate = restTemplateBuilder
                .setConnectTimeout(properties.connectTimeout())
                .setReadTimeout(properties.readTimeout())
                .build();
        return new BulkSmsGateway(restTemplate, properties);
    }
}

package com.hostelgate.backend.modules.leave.infrastructure.sms;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.sms")
public record SmsProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("https://www.bulksmsapps.com/api/apismsv2.aspx") String baseUrl,
        @DefaultValue("https://www.bulksmsapps.com/api/apibulkv2.aspx") String unicodeUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("PYDAHK") String senderId,
        @DefaultValue("1707175151835691501") String teluguTemplateId,
        @DefaultValue("1707175151753778713") String englishTemplateId,
        @DefaultValue("PT5S") Duration connectTimeout,
        @DefaultValue("PT30S") Duration readTimeout
) {
}

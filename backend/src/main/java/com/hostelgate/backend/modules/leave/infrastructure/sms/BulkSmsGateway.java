package com.hostelgate.backend.modules.leave.infrastructure.sms;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hostelgate.backend.modules.auth.domain.Gender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * BulkSMS client. Each OTP goes out twice, once with the Telugu DLT template over the unicode endpoint and
 * once with the English template. Delivery counts as successful when either message is accepted.
 */
public class BulkSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(BulkSmsGateway.class);

    static final String TELUGU_TEMPLATE =
            "ప్రియమైన తల్లిదండ్రులారా, మీ {#var#} {#var#} హాస్టల్ నుండి సెలవు కోరుతున్నారు. "
                    + "ఈ OTP {#var#} ని షేర్ చేయండి. మీరు అంగీకరిస్తేనే -Pydah Hostel";
    static final String ENGLISH_TEMPLATE =
            "Dear Parents, your child {#var#} is seeking leave from hostel. share this OTP {#var#}. "
                    + "Only if you would like to approve-Pydah Hostel";

    private static final String PLACEHOLDER = "{#var#}";
    private static final String SON = "కొడుకు";
    private static final String DAUGHTER = "కూతురు";
    private static final Pattern MESSAGE_ID = Pattern.compile("MessageId-(\\d+)");
    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");

    private final RestTemplate restTemplate;
    private final SmsProperties properties;

    public BulkSmsGateway(RestTemplate restTemplate, SmsProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public SmsDeliveryResult sendOtp(String phoneNumber, OtpMessage message) {
        String name = message.studentName() == null || message.studentName().isBlank() ? "Student" : message.studentName();
        String telugu = fill(TELUGU_TEMPLATE, childNoun(message.gender()), name, message.code());
        String english = fill(ENGLISH_TEMPLATE, name, message.code());

        List<String> messageIds = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        send(properties.unicodeUrl(), phoneNumber, telugu, properties.teluguTemplateId(), true)
                .ifPresentOrElse(messageIds::add, () -> failures.add("telugu"));
        send(properties.baseUrl(), phoneNumber, english, properties.englishTemplateId(), false)
                .ifPresentOrElse(messageIds::add, () -> failures.add("english"));

        if (messageIds.isEmpty()) {
            return SmsDeliveryResult.failed("SMS_REJECTED", "No OTP message was accepted by the provider");
        }
        if (!failures.isEmpty()) {
            log.warn("OTP SMS partially delivered to {}; failed variants={}", LoggingSmsGateway.mask(phoneNumber), failures);
        }
        return SmsDeliveryResult.delivered(String.join(",", messageIds));
    }

    private Optional<String> send(String url, String phoneNumber, String text, String templateId, boolean unicode) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url)
                .queryParam("apikey", properties.apiKey())
                .queryParam("sender", properties.senderId())
                .queryParam("number", phoneNumber)
                .queryParam("message", text)
                .queryParam("templateid", templateId);
        if (unicode) {
            builder.queryParam("coding", "3");
        }
        URI uri = builder.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.TEXT_PLAIN, MediaType.TEXT_HTML));
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(uri, new HttpEntity<>(headers), String.class);
            Optional<String> messageId = extractMessageId(response.getBody());
            if (messageId.isEmpty()) {
                log.warn("SMS provider returned an unexpected body for {}: {}", LoggingSmsGateway.mask(phoneNumber),
                        abbreviate(response.getBody()));
            }
            return messageId;
        } catch (RestClientException e) {
            log.warn("SMS request to {} failed: {}", LoggingSmsGateway.mask(phoneNumber), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * The provider answers either {@code MessageId-<digits>} (possibly wrapped in HTML) or a bare number.
     */
    static Optional<String> extractMessageId(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = MESSAGE_ID.matcher(body);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        String trimmed = body.trim();
        if (NUMERIC.matcher(trimmed).matches()) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }

    static String childNoun(Gender gender) {
        return gender == Gender.FEMALE ? DAUGHTER : SON;
    }

    static String fill(String template, String... values) {
        String result = template;
        for (String value : values) {
            int index = result.indexOf(PLACEHOLDER);
            if (index < 0) {
                break;
            }
            result = result.substring(0, index) + value + result.substring(index + PLACEHOLDER.length());
        }
        return result;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}

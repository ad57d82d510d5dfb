package com.loan.crm.service;

import com.loan.crm.dto.NotificationPayload;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Service
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    private final RestTemplate restTemplate;
    private final String webhookUrl;

    @Autowired
    public WebhookNotificationSink(RestTemplateBuilder builder,
                                   @Value("${crm.notification.rejection-webhook-url:}") String webhookUrl,
                                   @Value("${crm.http.connect-timeout-ms:3000}") long connectTimeoutMs,
                                   @Value("${crm.http.read-timeout-ms:5000}") long readTimeoutMs) {
        this(builder.setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build(), webhookUrl);
    }

    WebhookNotificationSink(RestTemplate restTemplate, String webhookUrl) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void send(NotificationPayload payload) {
        if (StringUtils.isBlank(webhookUrl)) {
            log.warn("Rejection webhook URL not set; skipping notification for {}", payload.phoneNumber());
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(webhookUrl,
                    new HttpEntity<>(payload, headers), String.class);
            log.info("Rejection webhook returned {} for {}", response.getStatusCode(), payload.phoneNumber());
        } catch (RestClientException e) {
            log.error("Rejection webhook failed for {}", payload.phoneNumber(), e);
            throw new ReconciliationException(ErrorKind.EXTERNAL_NOTIFY_FAILED,
                    "Rejection webhook failed: " + e.getMessage(), e);
        }
    }
}

package com.loan.crm.service;

import com.loan.crm.dto.EligibilityResult;
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
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Singapore mobile format check followed by the blocklist lookup. The lookup answers with the
 * names of the lists the number appears in; any hit makes the lead ineligible.
 */
@Service
public class RestEligibilityChecker implements EligibilityChecker {

    private static final Logger log = LoggerFactory.getLogger(RestEligibilityChecker.class);
    private static final Pattern SG_MOBILE = Pattern.compile("^[896]\\d{7}$");

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;

    @Autowired
    public RestEligibilityChecker(RestTemplateBuilder builder,
                                  @Value("${crm.eligibility.url:}") String url,
                                  @Value("${crm.eligibility.api-key:}") String apiKey,
                                  @Value("${crm.http.connect-timeout-ms:3000}") long connectTimeoutMs,
                                  @Value("${crm.http.read-timeout-ms:5000}") long readTimeoutMs) {
        this(builder.setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build(), url, apiKey);
    }

    RestEligibilityChecker(RestTemplate restTemplate, String url, String apiKey) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.apiKey = apiKey;
    }

    @Override
    public EligibilityResult check(String phoneKey, String fullName) {
        if (phoneKey == null || !SG_MOBILE.matcher(phoneKey).matches()) {
            return EligibilityResult.ineligible("Invalid phone number format. Must be a valid Singapore mobile number.");
        }
        if (StringUtils.isBlank(url)) {
            log.warn("Eligibility URL not set; treating {} as eligible", phoneKey);
            return EligibilityResult.eligible("List check not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.set("apikey", apiKey);
        }
        HttpEntity<Map<String, String>> request = new HttpEntity<>(Map.of("phone", phoneKey), headers);
        String[] lists;
        try {
            lists = restTemplate.postForObject(url, request, String[].class);
        } catch (RestClientException e) {
            log.error("Eligibility check failed for {}", phoneKey, e);
            throw new ReconciliationException(ErrorKind.ELIGIBILITY_CHECK_FAILED,
                    "Error checking eligibility: " + e.getMessage(), e);
        }
        if (lists != null && lists.length > 0) {
            return EligibilityResult.ineligible("Found in lists: " + String.join(", ", lists));
        }
        return EligibilityResult.eligible("Not found in any lists");
    }
}

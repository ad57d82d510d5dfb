package com.loan.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body posted to the rejection webhook when a customer is marked R.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("lead_id") Long leadId,
        @JsonProperty("borrower_id") Long borrowerId,
        String name,
        @JsonProperty("appointment_id") Long appointmentId,
        String code,
        @JsonProperty("appointment_type") String appointmentType,
        String timestamp
) {
}

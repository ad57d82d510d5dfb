package com.loan.crm.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class TimeslotGenerationRequest {
    private Integer daysAhead;
    private Long calendarSettingId;
}

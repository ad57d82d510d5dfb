package com.loan.crm.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
public class StatusUpdateRequest {

    private String mode;
    private Double thresholdHours;
    private List<Map<String, Object>> rows;

    @JsonProperty("spreadsheet_id")
    private String spreadsheetId;

    @JsonProperty("spreadsheet_name")
    private String spreadsheetName;

    private String sheet;
}

package com.loan.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusUpdateResponse {

    private final boolean success;
    private final String mode;
    private final String message;
    private final String details;
    private final String todaySingapore;
    private final Double thresholdHours;
    private final List<ReconciliationAction> results;
    private final Summary summary;

    @Getter
    @Builder
    public static class Summary {
        private final int totalActions;
        private final int successful;
        private final int failed;
        private final int processedRows;
        private final int successfulRows;
        private final int failedRows;
        private final int skippedRows;
        private final ActionTypes actionTypes;
    }

    @Getter
    @Builder
    public static class ActionTypes {
        @JsonProperty("leads_created")
        private final long leadsCreated;
        @JsonProperty("appointments_created")
        private final long appointmentsCreated;
        @JsonProperty("appointments_moved")
        private final long appointmentsMoved;
        @JsonProperty("appointments_updated")
        private final long appointmentsUpdated;
        @JsonProperty("timeout_updates")
        private final long timeoutUpdates;
        @JsonProperty("final_status_updates")
        private final long finalStatusUpdates;
    }

    public static StatusUpdateResponse from(RunSummary run) {
        List<ReconciliationAction> actions = run.actions();
        int ok = (int) run.successfulActions();
        return StatusUpdateResponse.builder()
                .success(true)
                .mode(run.mode().getValue())
                .message(String.format("Processed %d rows: %d succeeded, %d failed, %d skipped",
                        run.processedCount(), run.successCount(), run.errorCount(), run.skippedCount()))
                .todaySingapore(run.todaySingapore().toString())
                .thresholdHours(run.thresholdHours())
                .results(actions)
                .summary(Summary.builder()
                        .totalActions(actions.size())
                        .successful(ok)
                        .failed(actions.size() - ok)
                        .processedRows(run.processedCount())
                        .successfulRows(run.successCount())
                        .failedRows(run.errorCount())
                        .skippedRows(run.skippedCount())
                        .actionTypes(ActionTypes.builder()
                                .leadsCreated(run.count(ActionKind.CREATE_LEAD))
                                .appointmentsCreated(run.count(ActionKind.CREATE_APPOINTMENT))
                                .appointmentsMoved(run.count(ActionKind.MOVE_APPOINTMENT))
                                .appointmentsUpdated(run.count(ActionKind.UPDATE_APPOINTMENT)
                                        + run.count(ActionKind.UPDATE_BORROWER_APPOINTMENT))
                                .timeoutUpdates(run.count(ActionKind.TIMEOUT_APPOINTMENT))
                                .finalStatusUpdates(run.count(ActionKind.FINAL_STATUS_UPDATE))
                                .build())
                        .build())
                .build();
    }

    public static StatusUpdateResponse failure(String mode, String message, String details) {
        return StatusUpdateResponse.builder()
                .success(false)
                .mode(mode)
                .message(message)
                .details(details)
                .build();
    }
}

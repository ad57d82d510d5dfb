package com.loan.crm.controller;

import com.loan.crm.dto.RunMode;
import com.loan.crm.dto.RunSummary;
import com.loan.crm.dto.StatusUpdateRequest;
import com.loan.crm.dto.StatusUpdateResponse;
import com.loan.crm.service.BatchRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Webhook called by the call sheet. POST carries rows; GET runs the time-only sweep.
 */
@RestController
@RequestMapping("/appointments/status-update")
public class AppointmentStatusController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentStatusController.class);

    private final BatchRunner batchRunner;

    public AppointmentStatusController(BatchRunner batchRunner) {
        this.batchRunner = batchRunner;
    }

    @PostMapping
    public ResponseEntity<StatusUpdateResponse> update(@RequestBody(required = false) StatusUpdateRequest request) {
        StatusUpdateRequest body = request != null ? request : new StatusUpdateRequest();
        log.info("Status update webhook: mode={}, rows={}, spreadsheet={}, sheet={}",
                body.getMode(), body.getRows() != null ? body.getRows().size() : 0,
                body.getSpreadsheetName() != null ? body.getSpreadsheetName() : body.getSpreadsheetId(), body.getSheet());
        return run(body.getMode(), body.getRows(), body.getThresholdHours());
    }

    @GetMapping
    public ResponseEntity<StatusUpdateResponse> sweep(@RequestParam(required = false) String mode,
                                                      @RequestParam(required = false) Double thresholdHours) {
        return run(mode, List.of(), thresholdHours);
    }

    private ResponseEntity<StatusUpdateResponse> run(String rawMode, List<Map<String, Object>> rows, Double thresholdHours) {
        Optional<RunMode> mode = RunMode.parse(rawMode);
        if (mode.isEmpty()) {
            return ResponseEntity.badRequest().body(StatusUpdateResponse.failure(rawMode,
                    "Unknown mode '" + rawMode + "'", "Expected live, realtime or end_of_day"));
        }
        try {
            RunSummary summary = batchRunner.run(rows, mode.get(), thresholdHours);
            return ResponseEntity.ok(StatusUpdateResponse.from(summary));
        } catch (DataAccessException | TransactionException e) {
            log.error("Status update batch aborted", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(StatusUpdateResponse.failure(
                    mode.get().getValue(), "Batch aborted: storage unavailable", e.getMessage()));
        }
    }
}

package com.loan.crm.service;

import com.loan.crm.component.SingaporeClock;
import com.loan.crm.dto.ActionKind;
import com.loan.crm.dto.CallOutcome;
import com.loan.crm.dto.ReconciliationAction;
import com.loan.crm.dto.RunMode;
import com.loan.crm.dto.RunSummary;
import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one webhook call: rows in order through normalization and reconciliation, or one of the sweeps.
 * A failing row is reported and the batch continues; only unreachable storage aborts it.
 */
@Service
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final RowNormalizer rowNormalizer;
    private final ReconciliationOrchestrator orchestrator;
    private final TimeoutSweeper timeoutSweeper;
    private final EndOfDaySweeper endOfDaySweeper;
    private final SingaporeClock clock;
    private final double liveThresholdHours;
    private final double sweepThresholdHours;

    public BatchRunner(RowNormalizer rowNormalizer,
                       ReconciliationOrchestrator orchestrator,
                       TimeoutSweeper timeoutSweeper,
                       EndOfDaySweeper endOfDaySweeper,
                       SingaporeClock clock,
                       @Value("${crm.reconciliation.live-threshold-hours:3}") double liveThresholdHours,
                       @Value("${crm.reconciliation.sweep-threshold-hours:2.5}") double sweepThresholdHours) {
        this.rowNormalizer = rowNormalizer;
        this.orchestrator = orchestrator;
        this.timeoutSweeper = timeoutSweeper;
        this.endOfDaySweeper = endOfDaySweeper;
        this.clock = clock;
        this.liveThresholdHours = liveThresholdHours;
        this.sweepThresholdHours = sweepThresholdHours;
    }

    /**
     * @param thresholdHours null or negative for the configured default of the chosen path
     */
    public RunSummary run(List<Map<String, Object>> rows, RunMode mode, Double thresholdHours) {
        LocalDate today = clock.today();
        if (mode == RunMode.END_OF_DAY) {
            List<ReconciliationAction> actions = endOfDaySweeper.sweep();
            return summarize(mode, actions, 0, 0, 0, 0, today, threshold(thresholdHours, liveThresholdHours));
        }
        if (rows == null || rows.isEmpty()) {
            double threshold = threshold(thresholdHours, sweepThresholdHours);
            List<ReconciliationAction> actions = timeoutSweeper.sweep(threshold);
            return summarize(mode, actions, 0, 0, 0, 0, today, threshold);
        }

        double threshold = threshold(thresholdHours, liveThresholdHours);
        List<ReconciliationAction> actions = new ArrayList<>();
        int processed = 0;
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            CallOutcome outcome;
            try {
                outcome = rowNormalizer.normalize(rowNumber, rows.get(i));
            } catch (ReconciliationException e) {
                processed++;
                failed++;
                actions.add(ReconciliationAction.failure(ActionKind.REJECT_ROW, rowNumber, e.getKind(), e.getMessage()));
                continue;
            }
            if (outcome.rowDate() != null && !outcome.rowDate().equals(today)) {
                log.debug("Skipping row {} dated {}", rowNumber, outcome.rowDate());
                skipped++;
                continue;
            }

            processed++;
            List<ReconciliationAction> rowActions;
            try {
                rowActions = orchestrator.reconcile(outcome, threshold);
            } catch (ReconciliationException e) {
                rowActions = List.of(ReconciliationAction.failure(ActionKind.REJECT_ROW, rowNumber, e.getKind(), e.getMessage()));
            } catch (DataAccessException e) {
                ReconciliationOrchestrator.rethrowIfStorageDown(e);
                log.error("Row {} failed in storage", rowNumber, e);
                rowActions = List.of(ReconciliationAction.failure(ActionKind.REJECT_ROW, rowNumber,
                        ErrorKind.STORAGE_FAILURE, "Storage error: " + e.getMostSpecificCause().getMessage()));
            }
            actions.addAll(rowActions);
            if (rowActions.stream().allMatch(ReconciliationAction::isSuccess)) {
                succeeded++;
            } else {
                failed++;
            }
        }
        return summarize(mode, actions, processed, succeeded, failed, skipped, today, threshold);
    }

    private RunSummary summarize(RunMode mode, List<ReconciliationAction> actions, int processed, int succeeded,
                                 int failed, int skipped, LocalDate today, double threshold) {
        log.info("Run {} finished for {}: processed={}, succeeded={}, failed={}, skipped={}, actions={}",
                mode.getValue(), today, processed, succeeded, failed, skipped, actions.size());
        return new RunSummary(mode, processed, succeeded, failed, skipped, List.copyOf(actions), today, threshold);
    }

    private static double threshold(Double requested, double fallback) {
        return requested != null && requested >= 0 ? requested : fallback;
    }
}

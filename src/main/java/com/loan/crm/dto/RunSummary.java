package com.loan.crm.dto;

import java.time.LocalDate;
import java.util.List;

public record RunSummary(
        RunMode mode,
        int processedCount,
        int successCount,
        int errorCount,
        int skippedCount,
        List<ReconciliationAction> actions,
        LocalDate todaySingapore,
        double thresholdHours
) {

    public long count(ActionKind kind) {
        return actions.stream().filter(a -> a.getAction() == kind).count();
    }

    public long successfulActions() {
        return actions.stream().filter(ReconciliationAction::isSuccess).count();
    }
}

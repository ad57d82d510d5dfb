package com.loan.crm.service;

import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.EngineLeadStatus;
import com.loan.crm.entity.LoanCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a call outcome to the appointment and lead status it implies. No side effects.
 *
 * <pre>
 * RS                       appointment done, lead missed/RS
 * P, PRS, R                appointment done, lead done
 * UW filled, no code       appointment done, lead done
 * nothing, overdue         appointment missed, lead follow_up (recoverable) or missed/RS (final)
 * nothing, not overdue     no change
 * </pre>
 */
@Component
public class LeadStatusProjector {

    public enum MissPolicy {
        /** Time-only sweep: the customer can still be called back. */
        RECOVERABLE,
        /** End of day and live rows: the visit is over. */
        FINAL
    }

    public record Projection(AppointmentStatus appointmentStatus,
                             EngineLeadStatus leadStatus,
                             LoanCode loanStatus,
                             String loanNotes,
                             String reason) {

        public boolean notifies() {
            return loanStatus == LoanCode.R;
        }
    }

    public Optional<Projection> project(LoanCode code, boolean uwFilled, boolean thresholdExceeded,
                                        MissPolicy policy, String rsReason, String rsDetail) {
        if (code != null && code.isKnown()) {
            EngineLeadStatus lead = code == LoanCode.RS ? EngineLeadStatus.MISSED_RS : EngineLeadStatus.DONE;
            return Optional.of(new Projection(AppointmentStatus.DONE, lead, code,
                    loanNotes(code, rsReason, rsDetail), "Code " + code));
        }
        if (uwFilled) {
            return Optional.of(new Projection(AppointmentStatus.DONE, EngineLeadStatus.DONE, null, null,
                    "UW filled"));
        }
        if (thresholdExceeded) {
            return Optional.of(policy == MissPolicy.FINAL ? projectFinalMiss() : projectRecoverableMiss());
        }
        return Optional.empty();
    }

    public Projection projectRecoverableMiss() {
        return new Projection(AppointmentStatus.MISSED, EngineLeadStatus.FOLLOW_UP, null, null,
                "No show past threshold, follow up");
    }

    public Projection projectFinalMiss() {
        return new Projection(AppointmentStatus.MISSED, EngineLeadStatus.MISSED_RS, null, null,
                "No show past threshold");
    }

    /**
     * Final lead status derived from the loan status already stored on a completed appointment.
     */
    public Optional<EngineLeadStatus> projectPersistedLoanStatus(LoanCode loanStatus) {
        if (loanStatus == null || !loanStatus.isKnown()) {
            return Optional.empty();
        }
        return Optional.of(loanStatus == LoanCode.RS ? EngineLeadStatus.MISSED_RS : EngineLeadStatus.DONE);
    }

    public String loanNotes(LoanCode code, String rsReason, String rsDetail) {
        switch (code) {
            case P:
                return "P - Done";
            case PRS:
                return "PRS - Customer Rejected";
            case R:
                return "R - Rejected";
            case RS:
                String notes = "RS - " + StringUtils.defaultIfBlank(rsReason, "Rejected");
                if (StringUtils.isNotBlank(rsDetail)) {
                    notes += "\nRS Details: " + rsDetail.trim();
                }
                return notes;
            default:
                return null;
        }
    }
}

package com.loan.crm.entity;

/**
 * The closed set of lead statuses the reconciliation engine is allowed to write.
 * Engine write paths only accept this type, so any other status cannot be set by them.
 */
public enum EngineLeadStatus {

    NEW(LeadStatus.NEW),
    ASSIGNED(LeadStatus.ASSIGNED),
    FOLLOW_UP(LeadStatus.FOLLOW_UP),
    DONE(LeadStatus.DONE),
    MISSED_RS(LeadStatus.MISSED_RS);

    private final LeadStatus leadStatus;

    EngineLeadStatus(LeadStatus leadStatus) {
        this.leadStatus = leadStatus;
    }

    public LeadStatus toLeadStatus() {
        return leadStatus;
    }
}

package com.loan.crm.exception;

/**
 * Row-level failure of the reconciliation pipeline. The batch runner turns it into a failed action
 * and moves on to the next row.
 */
public class ReconciliationException extends RuntimeException {

    private final ErrorKind kind;

    public ReconciliationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReconciliationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ReconciliationException invalidRow(String message) {
        return new ReconciliationException(ErrorKind.INVALID_ROW, message);
    }

    public static ReconciliationException slotFull(Long slotId) {
        return new ReconciliationException(ErrorKind.SLOT_FULL, "Timeslot " + slotId + " is full");
    }
}

package com.loan.crm.dto;

public record EligibilityResult(boolean eligible, String notes) {

    public static EligibilityResult eligible(String notes) {
        return new EligibilityResult(true, notes);
    }

    public static EligibilityResult ineligible(String notes) {
        return new EligibilityResult(false, notes);
    }
}

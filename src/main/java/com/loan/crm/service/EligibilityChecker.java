package com.loan.crm.service;

import com.loan.crm.dto.EligibilityResult;

/**
 * Decides whether a new lead may be booked.
 */
public interface EligibilityChecker {

    /**
     * @param phoneKey 8-digit local number
     * @throws com.loan.crm.exception.ReconciliationException ELIGIBILITY_CHECK_FAILED when the check could not run
     */
    EligibilityResult check(String phoneKey, String fullName);
}

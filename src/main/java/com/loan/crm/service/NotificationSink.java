package com.loan.crm.service;

import com.loan.crm.dto.NotificationPayload;

/**
 * Outbound notification for rejected customers.
 */
public interface NotificationSink {

    /**
     * @throws com.loan.crm.exception.ReconciliationException EXTERNAL_NOTIFY_FAILED when delivery fails
     */
    void send(NotificationPayload payload);
}

package com.aitrader.backend.service.reconcile;

/**
 * @param checked trade plans examined
 * @param updated trade plans with at least one execution or status change
 * @param errors trade plans that could not be reconciled
 */
public record ReconcileReport(Long accountId, boolean skipped, int checked, int updated, int errors) {

    public static ReconcileReport skipped(Long accountId) {
        return new ReconcileReport(accountId, true, 0, 0, 0);
    }

    public static ReconcileReport failed(Long accountId) {
        return new ReconcileReport(accountId, false, 0, 0, 1);
    }
}

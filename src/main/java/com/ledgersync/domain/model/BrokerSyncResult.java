package com.ledgersync.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Per-broker outcome of the reconcile + balance stage. A failed broker carries its
 * error message; the other brokers of the iteration are unaffected.
 */
@Data
@Builder
public class BrokerSyncResult {

    private String broker;
    private boolean success;

    /** Null when reconciliation is disabled or failed. */
    private ReconciliationResult reconciliation;

    /** Null when balance derivation did not complete. */
    private BrokerBalanceResult balances;

    private String error;

    /** {@link com.ledgersync.exception.ErrorCode} code of the failure, when there was one. */
    private String errorCode;
}

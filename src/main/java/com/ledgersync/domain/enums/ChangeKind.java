package com.ledgersync.domain.enums;

/** Kind of ledger change produced by position reconciliation. */
public enum ChangeKind {
    DELETE,
    UPDATE,
    INSERT
}

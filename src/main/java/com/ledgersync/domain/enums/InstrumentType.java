package com.ledgersync.domain.enums;

/** Instrument classes that change how a position is valued. */
public enum InstrumentType {
    EQUITY,
    OPTION,
    FUTURE
}

package com.ledgersync.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of one valuation batch over ledger positions. */
@Data
@Builder
public class ValuationResult {

    private LocalDateTime asOf;
    private int evaluated;
    private int priced;
    private int volatilityUpdated;

    /** Symbols whose own price could not be fetched; those positions were left untouched. */
    @Builder.Default
    private List<String> failedSymbols = new ArrayList<>();
}

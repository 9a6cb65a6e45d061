package com.ledgersync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Rows retagged by a strategy rename, per table. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRenameResult {

    private String broker;
    private String oldStrategy;
    private String newStrategy;
    private int positions;
    private int balances;
    private int trades;
}

package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.core.model.Table;

/**
 * The fused table, {@code CompanyID} first, and a report of how it was built.
 */
public record FusionResult(Table table, FusionReport report) {
}

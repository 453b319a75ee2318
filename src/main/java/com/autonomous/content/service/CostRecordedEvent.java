package com.autonomous.content.service;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Published after every ledger insert. Listeners refresh derived aggregates.
 */
public record CostRecordedEvent(String organizationId, String pipelineId, YearMonth billingMonth, BigDecimal amount) {}

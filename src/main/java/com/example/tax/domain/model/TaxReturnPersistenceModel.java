package com.example.tax.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Snapshot stored for a computed return: who filed, and the headline figures
 * produced by the pipeline.
 */
public record TaxReturnPersistenceModel(
		int taxYear,
		FilingStatus filingStatus,
		int dependentCount,
		BigDecimal grossIncome,
		BigDecimal adjustedGrossIncome,
		DeductionKind deductionKind,
		BigDecimal taxableIncome,
		BigDecimal taxLiability,
		BigDecimal taxAfterCredits,
		BigDecimal totalPayments,
		BigDecimal refundAmount,
		BigDecimal amountOwed,
		List<AdjustmentType> appliedAdjustments) {

	public TaxReturnPersistenceModel {
		appliedAdjustments = List.copyOf(appliedAdjustments);
	}
}

package com.example.tax.domain.model;

import java.math.BigDecimal;

/**
 * The five independently computed pieces of total tax, and their sum.
 * taxableIncome is the base of the bracket walk.
 */
public record LiabilityBreakdown(
		BigDecimal taxableIncome,
		BigDecimal bracketTax,
		BigDecimal selfEmploymentTax,
		BigDecimal capitalGainsTax,
		BigDecimal netInvestmentIncomeTax,
		BigDecimal additionalMedicareTax,
		BigDecimal total) {
}

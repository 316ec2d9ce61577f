package com.example.tax.domain.config;

import java.math.BigDecimal;

/**
 * Preferential capital-gains tiers and the two surtaxes stacked on top of the
 * bracket tax.
 */
public record SurtaxRules(
		StatusAmounts capitalGainsZeroRateMax,
		StatusAmounts capitalGainsFifteenRateMax,
		BigDecimal capitalGainsMiddleRate,
		BigDecimal capitalGainsTopRate,
		BigDecimal netInvestmentIncomeRate,
		StatusAmounts netInvestmentIncomeThreshold,
		BigDecimal additionalMedicareRate,
		StatusAmounts additionalMedicareThreshold) {
}

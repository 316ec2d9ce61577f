package com.example.tax.domain.config;

import java.math.BigDecimal;

public record AdjustmentRules(
		BigDecimal educatorExpenseCap,
		BigDecimal studentLoanInterestCap,
		BigDecimal tipsDeductionMax,
		BigDecimal tipsPhaseoutRate,
		StatusAmounts tipsPhaseoutThreshold,
		BigDecimal overtimeDeductionMax,
		BigDecimal overtimeWageCliff) {
}

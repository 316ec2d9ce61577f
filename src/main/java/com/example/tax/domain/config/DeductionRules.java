package com.example.tax.domain.config;

import java.math.BigDecimal;

public record DeductionRules(
		StatusAmounts standardDeduction,
		BigDecimal additionalUnmarried,
		BigDecimal additionalMarried,
		BigDecimal seniorDeduction,
		int seniorAge,
		BigDecimal medicalAgiFloorRate,
		BigDecimal saltCap,
		BigDecimal autoLoanInterestCap,
		BigDecimal charitableAgiLimitRate,
		BigDecimal qbiRate,
		StatusAmounts qbiPhaseoutThreshold) {
}

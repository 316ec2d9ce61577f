package com.example.tax.app.dto;

import java.math.BigDecimal;

public record WithholdingEstimate(
		BigDecimal annualIncome,
		BigDecimal estimatedAnnualTax,
		PayFrequency payFrequency,
		BigDecimal recommendedPerPeriod,
		BigDecimal additionalWithholding,
		BigDecimal totalPerPeriod) {
}

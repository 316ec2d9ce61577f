package com.example.tax.domain.config;

import java.math.BigDecimal;

public record SelfEmploymentTaxRules(
		BigDecimal netEarningsFactor,
		BigDecimal socialSecurityRate,
		BigDecimal socialSecurityWageBase,
		BigDecimal medicareRate,
		BigDecimal deductibleShare) {
}

package com.example.tax.app.dto;

import java.math.BigDecimal;

// both rates are percentages, e.g. 22.00
public record QuickEstimateResult(TaxCalculationResult calculation, BigDecimal effectiveTaxRate,
		BigDecimal marginalTaxRate) {
}

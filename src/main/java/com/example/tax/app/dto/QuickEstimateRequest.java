package com.example.tax.app.dto;

import java.math.BigDecimal;

import com.example.tax.domain.model.FilingStatus;

/**
 * Flat inputs for an estimate without a full return. itemizedDeductions is a
 * single pre-summed amount; zero means standard deduction only.
 */
public record QuickEstimateRequest(
		FilingStatus filingStatus,
		BigDecimal w2Wages,
		BigDecimal federalWithheld,
		BigDecimal otherIncome,
		BigDecimal tipIncome,
		BigDecimal overtimeIncome,
		BigDecimal selfEmploymentIncome,
		int childrenForChildTaxCredit,
		int otherDependents,
		BigDecimal itemizedDeductions,
		boolean senior) {
}

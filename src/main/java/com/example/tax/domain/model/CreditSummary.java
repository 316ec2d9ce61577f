package com.example.tax.domain.model;

import java.math.BigDecimal;

import com.example.tax.domain.service.TaxRounding;

/**
 * Every credit on the return, split by whether it may push tax below zero.
 */
public record CreditSummary(
		ChildTaxCredit childTaxCredit,
		BigDecimal otherDependentCredit,
		BigDecimal earnedIncomeCredit,
		BigDecimal americanOpportunity,
		BigDecimal americanOpportunityRefundable,
		BigDecimal lifetimeLearning,
		BigDecimal retirementSavings,
		BigDecimal childAndDependentCare,
		BigDecimal foreignTax,
		BigDecimal residentialEnergy,
		BigDecimal electricVehicle,
		BigDecimal other) {

	public BigDecimal totalNonrefundable() {
		return TaxRounding.round(childTaxCredit.nonrefundable()
				.add(otherDependentCredit)
				.add(americanOpportunity)
				.add(lifetimeLearning)
				.add(retirementSavings)
				.add(childAndDependentCare)
				.add(foreignTax)
				.add(residentialEnergy)
				.add(electricVehicle)
				.add(other));
	}

	public BigDecimal totalRefundable() {
		return TaxRounding.round(childTaxCredit.refundable()
				.add(earnedIncomeCredit)
				.add(americanOpportunityRefundable));
	}
}

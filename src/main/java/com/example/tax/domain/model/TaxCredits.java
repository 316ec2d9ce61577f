package com.example.tax.domain.model;

import static com.example.tax.domain.model.IncomeRecord.orZero;

import java.math.BigDecimal;

/**
 * Credit line items supplied by the caller. Child, other-dependent and earned
 * income credits are computed by the engine and are not part of this record.
 */
public record TaxCredits(
		BigDecimal americanOpportunity,
		BigDecimal lifetimeLearning,
		BigDecimal retirementSavings,
		BigDecimal childAndDependentCare,
		BigDecimal foreignTax,
		BigDecimal residentialEnergy,
		BigDecimal electricVehicle,
		BigDecimal other) {

	public TaxCredits {
		americanOpportunity = orZero(americanOpportunity);
		lifetimeLearning = orZero(lifetimeLearning);
		retirementSavings = orZero(retirementSavings);
		childAndDependentCare = orZero(childAndDependentCare);
		foreignTax = orZero(foreignTax);
		residentialEnergy = orZero(residentialEnergy);
		electricVehicle = orZero(electricVehicle);
		other = orZero(other);
	}

	public static TaxCredits none() {
		return new TaxCredits(null, null, null, null, null, null, null, null);
	}
}

package com.example.tax.domain.model;

import static com.example.tax.domain.model.IncomeRecord.orZero;

import java.math.BigDecimal;

// raw above-the-line amounts, caps are applied by the adjustment policies
public record AdjustmentInputs(
		BigDecimal educatorExpenses,
		BigDecimal hsaDeduction,
		BigDecimal selfEmployedHealthInsurance,
		BigDecimal sepSimpleContributions,
		BigDecimal studentLoanInterest,
		BigDecimal iraDeduction) {

	public AdjustmentInputs {
		educatorExpenses = orZero(educatorExpenses);
		hsaDeduction = orZero(hsaDeduction);
		selfEmployedHealthInsurance = orZero(selfEmployedHealthInsurance);
		sepSimpleContributions = orZero(sepSimpleContributions);
		studentLoanInterest = orZero(studentLoanInterest);
		iraDeduction = orZero(iraDeduction);
	}

	public static AdjustmentInputs none() {
		return new AdjustmentInputs(null, null, null, null, null, null);
	}
}

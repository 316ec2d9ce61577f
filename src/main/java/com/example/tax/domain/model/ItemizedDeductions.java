package com.example.tax.domain.model;

import static com.example.tax.domain.model.IncomeRecord.orZero;

import java.math.BigDecimal;

import com.example.tax.domain.service.TaxRounding;

/**
 * Schedule A amounts as entered. The AGI-dependent limits (medical floor,
 * charitable ceiling) are applied by the deduction selector.
 */
public record ItemizedDeductions(
		BigDecimal medicalAndDental,
		BigDecimal stateLocalIncomeTax,
		BigDecimal stateLocalSalesTax,
		BigDecimal realEstateTax,
		BigDecimal personalPropertyTax,
		BigDecimal mortgageInterest,
		BigDecimal mortgagePoints,
		BigDecimal investmentInterest,
		BigDecimal autoLoanInterest,
		BigDecimal cashContributions,
		BigDecimal noncashContributions,
		BigDecimal casualtyLosses,
		BigDecimal gamblingLosses,
		BigDecimal otherDeductions) {

	public ItemizedDeductions {
		medicalAndDental = orZero(medicalAndDental);
		stateLocalIncomeTax = orZero(stateLocalIncomeTax);
		stateLocalSalesTax = orZero(stateLocalSalesTax);
		realEstateTax = orZero(realEstateTax);
		personalPropertyTax = orZero(personalPropertyTax);
		mortgageInterest = orZero(mortgageInterest);
		mortgagePoints = orZero(mortgagePoints);
		investmentInterest = orZero(investmentInterest);
		autoLoanInterest = orZero(autoLoanInterest);
		cashContributions = orZero(cashContributions);
		noncashContributions = orZero(noncashContributions);
		casualtyLosses = orZero(casualtyLosses);
		gamblingLosses = orZero(gamblingLosses);
		otherDeductions = orZero(otherDeductions);
	}

	public BigDecimal totalSalt(BigDecimal saltCap) {
		BigDecimal total = TaxRounding.round(stateLocalIncomeTax
				.add(stateLocalSalesTax)
				.add(realEstateTax)
				.add(personalPropertyTax));
		return total.min(saltCap);
	}

	public BigDecimal totalInterest(BigDecimal autoLoanInterestCap) {
		return TaxRounding.round(mortgageInterest
				.add(mortgagePoints)
				.add(investmentInterest)
				.add(autoLoanInterest.min(autoLoanInterestCap)));
	}

	// the AGI percentage ceiling comes later
	public BigDecimal totalCharitable() {
		return TaxRounding.round(cashContributions.add(noncashContributions));
	}
}

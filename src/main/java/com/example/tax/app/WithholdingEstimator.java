package com.example.tax.app;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import com.example.tax.app.dto.PayFrequency;
import com.example.tax.app.dto.WithholdingEstimate;
import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.service.TaxRounding;

/**
 * Suggests per-paycheck federal withholding from annual income, using the
 * engine's standard deduction and bracket schedule.
 */
public class WithholdingEstimator {
	private final TaxCalculationService engine;

	public WithholdingEstimator(TaxCalculationService engine) {
		this.engine = engine;
	}

	public WithholdingEstimate estimate(FilingStatus status, BigDecimal annualIncome, PayFrequency frequency,
			BigDecimal additionalWithholding, BigDecimal preTaxDeductions) {
		if (status == null)
			throw new InvalidTaxReturnException("filing status must not be null");
		PayFrequency payFrequency = Objects.requireNonNullElse(frequency, PayFrequency.BIWEEKLY);
		BigDecimal income = requireNonNegative(annualIncome, "annual income");
		BigDecimal additional = requireNonNegative(additionalWithholding, "additional withholding");
		BigDecimal preTax = requireNonNegative(preTaxDeductions, "pre-tax deductions");

		BigDecimal taxable = TaxRounding.nonNegative(income
				.subtract(preTax)
				.subtract(engine.config().standardDeductionFor(status)));
		BigDecimal annualTax = engine.liabilityCalculator().bracketTax(taxable, status);
		BigDecimal perPeriod = annualTax.divide(BigDecimal.valueOf(payFrequency.periodsPerYear()), TaxRounding.SCALE,
				RoundingMode.HALF_UP);

		return new WithholdingEstimate(TaxRounding.round(income), annualTax, payFrequency, perPeriod,
				TaxRounding.round(additional), TaxRounding.round(perPeriod.add(additional)));
	}

	private static BigDecimal requireNonNegative(BigDecimal amount, String name) {
		BigDecimal value = amount != null ? amount : BigDecimal.ZERO;
		if (value.signum() < 0)
			throw new InvalidTaxReturnException(name + " must be >= 0");
		return value;
	}
}

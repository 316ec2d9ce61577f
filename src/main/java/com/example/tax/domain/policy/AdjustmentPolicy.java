package com.example.tax.domain.policy;

import java.math.BigDecimal;

import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;

public interface AdjustmentPolicy {
	/**
	 * grossIncome: gross income of the return, the base of income-tested phase-outs.
	 * Returns the rounded adjustment amount (>= 0).
	 */
	BigDecimal amount(TaxReturn taxReturn, BigDecimal grossIncome);

	AdjustmentType type();
}

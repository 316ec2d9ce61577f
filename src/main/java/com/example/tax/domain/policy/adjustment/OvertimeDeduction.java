package com.example.tax.domain.policy.adjustment;

import java.math.BigDecimal;

import com.example.tax.domain.config.AdjustmentRules;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;
import com.example.tax.domain.service.TaxRounding;

/**
 * Overtime pay up to the yearly maximum. W-2 wages at or above the cliff
 * remove the deduction entirely; there is no gradual phase-out.
 */
public class OvertimeDeduction implements AdjustmentPolicy {
	private final AdjustmentRules rules;

	public OvertimeDeduction(AdjustmentRules rules) {
		this.rules = rules;
	}

	@Override
	public BigDecimal amount(TaxReturn taxReturn, BigDecimal grossIncome) {
		BigDecimal overtime = taxReturn.totalOvertimeIncome();
		if (overtime.signum() <= 0)
			return TaxRounding.zero();
		if (taxReturn.totalW2Wages().compareTo(rules.overtimeWageCliff()) >= 0)
			return TaxRounding.zero();
		return TaxRounding.round(overtime.min(rules.overtimeDeductionMax()));
	}

	@Override
	public AdjustmentType type() {
		return AdjustmentType.OVERTIME;
	}
}

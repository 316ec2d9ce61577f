package com.example.tax.domain.policy.adjustment;

import java.math.BigDecimal;

import com.example.tax.domain.config.AdjustmentRules;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;
import com.example.tax.domain.service.TaxRounding;

/**
 * Tip income up to the yearly maximum, reduced by a share of gross income above
 * the filing-status threshold. Never negative.
 */
public class TipsDeduction implements AdjustmentPolicy {
	private final AdjustmentRules rules;

	public TipsDeduction(AdjustmentRules rules) {
		this.rules = rules;
	}

	@Override
	public BigDecimal amount(TaxReturn taxReturn, BigDecimal grossIncome) {
		BigDecimal tips = taxReturn.totalTipIncome();
		if (tips.signum() <= 0)
			return TaxRounding.zero();

		BigDecimal deduction = tips.min(rules.tipsDeductionMax());
		BigDecimal threshold = rules.tipsPhaseoutThreshold().get(taxReturn.filingStatus());
		if (grossIncome.compareTo(threshold) > 0) {
			BigDecimal phaseout = TaxRounding.round(grossIncome.subtract(threshold).multiply(rules.tipsPhaseoutRate()));
			deduction = deduction.subtract(phaseout).max(BigDecimal.ZERO);
		}
		return TaxRounding.round(deduction);
	}

	@Override
	public AdjustmentType type() {
		return AdjustmentType.TIPS;
	}
}

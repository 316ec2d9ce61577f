package com.example.tax.domain.config;

import java.math.BigDecimal;
import java.util.List;

/**
 * Child tax credit amounts and phase-out, the flat other-dependent credit,
 * and the simplified earned income credit table. Each EIC list is indexed by
 * qualifying-child count; the last row covers that count and above.
 */
public record CreditRules(
		BigDecimal childCreditPerChild,
		BigDecimal childCreditRefundablePerChild,
		StatusAmounts childCreditPhaseoutThreshold,
		BigDecimal childCreditPhaseoutStep,
		BigDecimal childCreditPhaseoutIncrement,
		BigDecimal otherDependentCredit,
		BigDecimal americanOpportunityRefundableShare,
		List<EarnedIncomeCreditRow> earnedIncomeJoint,
		List<EarnedIncomeCreditRow> earnedIncomeOther) {

	public CreditRules {
		earnedIncomeJoint = List.copyOf(earnedIncomeJoint);
		earnedIncomeOther = List.copyOf(earnedIncomeOther);
		if (earnedIncomeJoint.isEmpty() || earnedIncomeOther.isEmpty())
			throw new IllegalArgumentException("earned income credit tables must not be empty");
	}
}

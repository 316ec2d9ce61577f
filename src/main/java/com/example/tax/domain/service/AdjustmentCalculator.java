package com.example.tax.domain.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.example.tax.domain.config.AdjustmentRules;
import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.AdjustmentResult;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;
import com.example.tax.domain.policy.adjustment.CappedAdjustment;
import com.example.tax.domain.policy.adjustment.OvertimeDeduction;
import com.example.tax.domain.policy.adjustment.SelfEmploymentTaxAdjustment;
import com.example.tax.domain.policy.adjustment.TipsDeduction;

/**
 * Runs the above-the-line adjustment policies in order and sums them. Every
 * policy sees the same gross income; none depends on another's result.
 */
public class AdjustmentCalculator {
	private final List<AdjustmentPolicy> policies;

	public AdjustmentCalculator(AdjustmentRules rules, SelfEmploymentTaxCalculator selfEmploymentTax) {
		this(List.of(
				new CappedAdjustment(AdjustmentType.EDUCATOR_EXPENSES, AdjustmentInputs::educatorExpenses,
						rules.educatorExpenseCap()),
				CappedAdjustment.uncapped(AdjustmentType.HSA, AdjustmentInputs::hsaDeduction),
				new SelfEmploymentTaxAdjustment(selfEmploymentTax),
				CappedAdjustment.uncapped(AdjustmentType.SELF_EMPLOYED_HEALTH_INSURANCE,
						AdjustmentInputs::selfEmployedHealthInsurance),
				CappedAdjustment.uncapped(AdjustmentType.SEP_SIMPLE, AdjustmentInputs::sepSimpleContributions),
				new CappedAdjustment(AdjustmentType.STUDENT_LOAN_INTEREST, AdjustmentInputs::studentLoanInterest,
						rules.studentLoanInterestCap()),
				CappedAdjustment.uncapped(AdjustmentType.IRA, AdjustmentInputs::iraDeduction),
				new TipsDeduction(rules),
				new OvertimeDeduction(rules)));
	}

	public AdjustmentCalculator(List<AdjustmentPolicy> policies) {
		this.policies = List.copyOf(policies);
	}

	public AdjustmentResult calculate(TaxReturn taxReturn, BigDecimal grossIncome) {
		BigDecimal total = BigDecimal.ZERO;
		Map<AdjustmentType, BigDecimal> amounts = new EnumMap<>(AdjustmentType.class);
		List<AdjustmentType> applied = new ArrayList<>();

		for (var policy : policies) {
			BigDecimal amount = policy.amount(taxReturn, grossIncome);
			amounts.put(policy.type(), amount);
			if (amount.signum() != 0) {
				applied.add(policy.type());
			}
			total = total.add(amount);
		}
		return new AdjustmentResult(TaxRounding.round(total), amounts, applied);
	}
}

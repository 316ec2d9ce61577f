package com.example.tax.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import com.example.tax.domain.config.CreditRules;
import com.example.tax.domain.config.EarnedIncomeCreditRow;
import com.example.tax.domain.model.ChildTaxCredit;
import com.example.tax.domain.model.CreditSummary;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.TaxCredits;
import com.example.tax.domain.model.TaxReturn;

public class CreditCalculator {
	private static final int RATIO_SCALE = 10;

	private final CreditRules rules;

	public CreditCalculator(CreditRules rules) {
		this.rules = rules;
	}

	public CreditSummary calculate(TaxReturn taxReturn, BigDecimal agi) {
		TaxCredits entered = taxReturn.credits();
		// the full credit counts as nonrefundable; the refundable share is added on top
		BigDecimal aocRefundable = TaxRounding.round(
				entered.americanOpportunity().multiply(rules.americanOpportunityRefundableShare()));

		return new CreditSummary(
				childTaxCredit(taxReturn, agi),
				otherDependentCredit(taxReturn),
				earnedIncomeCredit(taxReturn, agi),
				TaxRounding.round(entered.americanOpportunity()),
				aocRefundable,
				TaxRounding.round(entered.lifetimeLearning()),
				TaxRounding.round(entered.retirementSavings()),
				TaxRounding.round(entered.childAndDependentCare()),
				TaxRounding.round(entered.foreignTax()),
				TaxRounding.round(entered.residentialEnergy()),
				TaxRounding.round(entered.electricVehicle()),
				TaxRounding.round(entered.other()));
	}

	/**
	 * Per-child credit reduced by a fixed step for every started increment of AGI
	 * above the threshold. The refundable part is capped at what remains.
	 */
	public ChildTaxCredit childTaxCredit(TaxReturn taxReturn, BigDecimal agi) {
		int children = taxReturn.qualifyingChildrenCount();
		if (children == 0)
			return new ChildTaxCredit(TaxRounding.zero(), TaxRounding.zero());

		BigDecimal count = BigDecimal.valueOf(children);
		BigDecimal total = rules.childCreditPerChild().multiply(count);
		BigDecimal refundable = rules.childCreditRefundablePerChild().multiply(count);

		BigDecimal threshold = rules.childCreditPhaseoutThreshold().get(taxReturn.filingStatus());
		if (agi.compareTo(threshold) > 0) {
			BigDecimal increments = agi.subtract(threshold)
					.divide(rules.childCreditPhaseoutIncrement(), 0, RoundingMode.CEILING);
			BigDecimal reduction = TaxRounding.round(increments.multiply(rules.childCreditPhaseoutStep()));
			total = total.subtract(reduction).max(BigDecimal.ZERO);
		}
		refundable = refundable.min(total);
		return new ChildTaxCredit(TaxRounding.round(total), TaxRounding.round(refundable));
	}

	public BigDecimal otherDependentCredit(TaxReturn taxReturn) {
		return TaxRounding.round(rules.otherDependentCredit().multiply(BigDecimal.valueOf(taxReturn.otherDependentsCount())));
	}

	/**
	 * Linear approximation of the IRS earned income credit table: the maximum
	 * credit scaled down by AGI as a share of the ceiling for the child count.
	 * Not statutorily exact. Negative AGI is treated as zero.
	 */
	public BigDecimal earnedIncomeCredit(TaxReturn taxReturn, BigDecimal agi) {
		BigDecimal earnedIncome = taxReturn.totalW2Wages().add(taxReturn.totalSelfEmploymentProfit());
		if (earnedIncome.signum() <= 0)
			return TaxRounding.zero();

		EarnedIncomeCreditRow row = earnedIncomeRow(taxReturn.filingStatus(), taxReturn.qualifyingChildrenCount());
		if (agi.compareTo(row.maxAgi()) > 0)
			return TaxRounding.zero();

		BigDecimal share = agi.max(BigDecimal.ZERO).divide(row.maxAgi(), RATIO_SCALE, RoundingMode.HALF_UP);
		return TaxRounding.round(row.maxCredit().multiply(BigDecimal.ONE.subtract(share)));
	}

	private EarnedIncomeCreditRow earnedIncomeRow(FilingStatus status, int children) {
		List<EarnedIncomeCreditRow> table = switch (status) {
		case MARRIED_JOINT -> rules.earnedIncomeJoint();
		case SINGLE, MARRIED_SEPARATE, HEAD_OF_HOUSEHOLD, QUALIFYING_WIDOW -> rules.earnedIncomeOther();
		};
		return table.get(Math.min(children, table.size() - 1));
	}
}

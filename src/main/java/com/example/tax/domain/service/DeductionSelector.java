package com.example.tax.domain.service;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.tax.domain.config.DeductionRules;
import com.example.tax.domain.model.DeductionKind;
import com.example.tax.domain.model.DeductionResult;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.ItemizedDeductions;
import com.example.tax.domain.model.SelfEmploymentLedger;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.model.TaxpayerProfile;

/**
 * Standard versus itemized deduction, and the qualified business income
 * deduction taken separately from that choice.
 */
public class DeductionSelector {
	private static final Logger log = LoggerFactory.getLogger(DeductionSelector.class);

	private final DeductionRules rules;
	private final int taxYear;

	public DeductionSelector(DeductionRules rules, int taxYear) {
		this.rules = rules;
		this.taxYear = taxYear;
	}

	/**
	 * Itemized wins only when it was supplied and is strictly larger; ties go to
	 * the standard deduction.
	 */
	public DeductionResult select(TaxReturn taxReturn, BigDecimal agi) {
		BigDecimal standard = standardDeduction(taxReturn);
		BigDecimal itemized = taxReturn.hasItemizedDeductions()
				? itemizedDeduction(taxReturn.itemizedDeductions(), agi)
				: TaxRounding.zero();

		if (taxReturn.hasItemizedDeductions() && itemized.compareTo(standard) > 0) {
			return new DeductionResult(itemized, DeductionKind.ITEMIZED, standard, itemized);
		}
		return new DeductionResult(standard, DeductionKind.STANDARD, standard, itemized);
	}

	public BigDecimal standardDeduction(TaxReturn taxReturn) {
		FilingStatus status = taxReturn.filingStatus();
		BigDecimal additionalPerCondition = additionalAmount(status);
		BigDecimal total = rules.standardDeduction().get(status);

		TaxpayerProfile taxpayer = taxReturn.taxpayer();
		total = total.add(conditions(taxpayer).multiply(additionalPerCondition));

		if (taxReturn.hasSpouse() && status == FilingStatus.MARRIED_JOINT) {
			total = total.add(conditions(taxReturn.spouse()).multiply(rules.additionalMarried()));
		}
		// senior add-on, standard deduction only
		if (taxpayer.ageAtYearEnd(taxYear) >= rules.seniorAge()) {
			total = total.add(rules.seniorDeduction());
		}
		return TaxRounding.round(total);
	}

	public BigDecimal itemizedDeduction(ItemizedDeductions itemized, BigDecimal agi) {
		BigDecimal medicalFloor = TaxRounding.nonNegative(agi.multiply(rules.medicalAgiFloorRate()));
		BigDecimal medical = itemized.medicalAndDental().subtract(medicalFloor).max(BigDecimal.ZERO);

		BigDecimal charitableCeiling = TaxRounding.nonNegative(agi.multiply(rules.charitableAgiLimitRate()));
		BigDecimal charitable = itemized.totalCharitable().min(charitableCeiling);

		BigDecimal total = medical
				.add(itemized.totalSalt(rules.saltCap()))
				.add(itemized.totalInterest(rules.autoLoanInterestCap()))
				.add(charitable)
				.add(itemized.casualtyLosses())
				.add(itemized.gamblingLosses())
				.add(itemized.otherDeductions());
		return TaxRounding.round(total);
	}

	/**
	 * A flat share of positive business profits. The statutory high-income
	 * phase-out is not applied; above the threshold the full amount is still
	 * allowed and a warning is logged.
	 */
	public BigDecimal qbiDeduction(TaxReturn taxReturn, BigDecimal agi) {
		BigDecimal qualifiedIncome = taxReturn.incomesOf(SelfEmploymentLedger.class).stream()
				.map(SelfEmploymentLedger::netProfit)
				.filter(profit -> profit.signum() > 0)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		if (qualifiedIncome.signum() <= 0)
			return TaxRounding.zero();

		BigDecimal threshold = rules.qbiPhaseoutThreshold().get(taxReturn.filingStatus());
		if (agi.compareTo(threshold) > 0) {
			log.warn("AGI {} exceeds QBI phase-out threshold {}; phase-out not applied", agi, threshold);
		}
		return TaxRounding.round(qualifiedIncome.multiply(rules.qbiRate()));
	}

	private BigDecimal additionalAmount(FilingStatus status) {
		return switch (status) {
		case SINGLE, HEAD_OF_HOUSEHOLD -> rules.additionalUnmarried();
		case MARRIED_JOINT, MARRIED_SEPARATE, QUALIFYING_WIDOW -> rules.additionalMarried();
		};
	}

	// one add-on each for age and blindness
	private BigDecimal conditions(TaxpayerProfile profile) {
		int count = 0;
		if (profile.ageAtYearEnd(taxYear) >= rules.seniorAge())
			count++;
		if (profile.blind())
			count++;
		return BigDecimal.valueOf(count);
	}
}

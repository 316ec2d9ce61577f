package com.example.tax.app;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.tax.app.dto.TaxCalculationResult;
import com.example.tax.domain.config.TaxYearConfig;
import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.AdjustmentResult;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.CreditSummary;
import com.example.tax.domain.model.DeductionResult;
import com.example.tax.domain.model.LiabilityBreakdown;
import com.example.tax.domain.model.Settlement;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.service.AdjustmentCalculator;
import com.example.tax.domain.service.CreditCalculator;
import com.example.tax.domain.service.DeductionSelector;
import com.example.tax.domain.service.IncomeAggregator;
import com.example.tax.domain.service.SelfEmploymentTaxCalculator;
import com.example.tax.domain.service.SettlementCalculator;
import com.example.tax.domain.service.TaxLiabilityCalculator;
import com.example.tax.domain.service.TaxRounding;
import com.example.tax.domain.validation.TaxReturnValidator;
import com.example.tax.port.outbound.TaxYearConfigRepository;

/**
 * The single federal tax pipeline for one tax year. Stages run strictly in
 * order and each consumes only the return and earlier stage results:
 * gross income, adjustments, AGI, deduction, taxable income, liability,
 * credits, payments and settlement.
 *
 * Holds no state beyond its immutable configuration, so one instance may serve
 * any number of threads.
 */
public class TaxCalculationService {
	private static final Logger log = LoggerFactory.getLogger(TaxCalculationService.class);

	private final TaxYearConfig config;
	private final IncomeAggregator incomes;
	private final AdjustmentCalculator adjustments;
	private final DeductionSelector deductions;
	private final TaxLiabilityCalculator liability;
	private final CreditCalculator credits;
	private final SettlementCalculator settlement;

	public TaxCalculationService(TaxYearConfig config) {
		SelfEmploymentTaxCalculator selfEmploymentTax = new SelfEmploymentTaxCalculator(config.selfEmployment());
		this.config = config;
		this.incomes = new IncomeAggregator();
		this.adjustments = new AdjustmentCalculator(config.adjustments(), selfEmploymentTax);
		this.deductions = new DeductionSelector(config.deductions(), config.taxYear());
		this.liability = new TaxLiabilityCalculator(config, selfEmploymentTax, incomes);
		this.credits = new CreditCalculator(config.credits());
		this.settlement = new SettlementCalculator();
	}

	public static TaxCalculationService forYear(TaxYearConfigRepository repository, int taxYear) {
		TaxYearConfig config = repository.findByYear(taxYear)
				.orElseThrow(() -> TaxConfigurationException.unsupportedYear(taxYear));
		return new TaxCalculationService(config);
	}

	public static TaxCalculationService forDefaultYear(TaxYearConfigRepository repository) {
		return forYear(repository, repository.defaultYear());
	}

	public int taxYear() {
		return config.taxYear();
	}

	public TaxYearConfig config() {
		return config;
	}

	public TaxLiabilityCalculator liabilityCalculator() {
		return liability;
	}

	public TaxCalculationResult calculate(TaxReturn taxReturn) {
		TaxReturnValidator.validate(taxReturn);
		if (taxReturn.taxYear() != config.taxYear())
			throw new InvalidTaxReturnException(
					"return is for tax year " + taxReturn.taxYear() + " but engine is configured for " + config.taxYear());

		// --- income and AGI ---
		BigDecimal grossIncome = incomes.grossIncome(taxReturn);
		AdjustmentResult adjustmentResult = adjustments.calculate(taxReturn, grossIncome);
		BigDecimal agi = TaxRounding.round(grossIncome.subtract(adjustmentResult.total()));
		log.debug("gross={} adjustments={} agi={} applied={}", grossIncome, adjustmentResult.total(), agi,
				adjustmentResult.applied());

		// --- deduction and taxable income ---
		DeductionResult deduction = deductions.select(taxReturn, agi);
		BigDecimal qbi = deductions.qbiDeduction(taxReturn, agi);
		BigDecimal taxableIncome = TaxRounding.nonNegative(agi.subtract(deduction.amount()).subtract(qbi));
		log.debug("deduction={} ({}) qbi={} taxable={}", deduction.amount(), deduction.kind(), qbi, taxableIncome);

		// --- liability and credits ---
		LiabilityBreakdown tax = liability.calculate(taxReturn, taxableIncome, agi);
		CreditSummary creditSummary = credits.calculate(taxReturn, agi);
		BigDecimal nonrefundable = creditSummary.totalNonrefundable();
		BigDecimal refundable = creditSummary.totalRefundable();
		BigDecimal taxAfterCredits = TaxRounding.nonNegative(tax.total().subtract(nonrefundable));

		// --- payments and settlement ---
		BigDecimal totalPayments = settlement.totalPayments(taxReturn, refundable);
		Settlement balance = settlement.settle(taxAfterCredits, totalPayments);

		log.info("Calculated {} {} return: taxable={} liability={} refund={} owed={}", taxReturn.taxYear(),
				taxReturn.filingStatus(), taxableIncome, tax.total(), balance.refund(), balance.owed());

		return new TaxCalculationResult(
				config.taxYear(),
				grossIncome,
				adjustmentResult.total(),
				agi,
				deduction.amount(),
				deduction.kind(),
				qbi,
				taxableIncome,
				tax.total(),
				nonrefundable,
				refundable,
				taxAfterCredits,
				totalPayments,
				taxReturn.totalFederalWithheld(),
				TaxRounding.round(taxReturn.payments().estimatedPayments()),
				balance.refund(),
				balance.owed(),
				adjustmentResult.amountOf(AdjustmentType.TIPS),
				adjustmentResult.amountOf(AdjustmentType.OVERTIME),
				creditSummary.childTaxCredit().total(),
				adjustmentResult.applied(),
				tax,
				creditSummary);
	}
}

package com.example.tax.app;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.example.tax.app.dto.QuickEstimateRequest;
import com.example.tax.app.dto.QuickEstimateResult;
import com.example.tax.app.dto.TaxCalculationResult;
import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.Dependent;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.IncomeRecord;
import com.example.tax.domain.model.ItemizedDeductions;
import com.example.tax.domain.model.Payments;
import com.example.tax.domain.model.SelfEmploymentLedger;
import com.example.tax.domain.model.TaxCredits;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.model.TaxpayerProfile;
import com.example.tax.domain.service.TaxRounding;

/**
 * Turns a flat estimate request into a minimal return and runs it through the
 * shared pipeline, so estimates and filed returns never disagree.
 */
public class QuickEstimateService {
	private static final BigDecimal HUNDRED = new BigDecimal("100");
	private static final int NON_SENIOR_AGE = 40;

	private final TaxCalculationService engine;

	public QuickEstimateService(TaxCalculationService engine) {
		this.engine = engine;
	}

	public QuickEstimateResult estimate(QuickEstimateRequest request) {
		validate(request);
		TaxReturn taxReturn = toTaxReturn(request);
		TaxCalculationResult calculation = engine.calculate(taxReturn);

		BigDecimal effectiveRate = calculation.grossIncome().signum() > 0
				? calculation.taxLiability().multiply(HUNDRED).divide(calculation.grossIncome(), TaxRounding.SCALE,
						RoundingMode.HALF_UP)
				: TaxRounding.zero();
		BigDecimal marginalRate = TaxRounding.round(engine.liabilityCalculator()
				.marginalRate(calculation.liability().taxableIncome(), request.filingStatus())
				.multiply(HUNDRED));
		return new QuickEstimateResult(calculation, effectiveRate, marginalRate);
	}

	private static void validate(QuickEstimateRequest request) {
		if (request == null)
			throw new InvalidTaxReturnException("estimate request must not be null");
		if (request.filingStatus() == null)
			throw new InvalidTaxReturnException("filing status must not be null");
		if (request.childrenForChildTaxCredit() < 0 || request.otherDependents() < 0)
			throw new InvalidTaxReturnException("dependent counts must be >= 0");
	}

	TaxReturn toTaxReturn(QuickEstimateRequest request) {
		int year = engine.taxYear();
		FilingStatus status = request.filingStatus();

		TaxpayerProfile taxpayer = profileAged(year, request.senior() ? engine.config().deductions().seniorAge()
				: NON_SENIOR_AGE);
		TaxpayerProfile spouse = status.requiresSpouse() ? profileAged(year, NON_SENIOR_AGE) : null;

		List<Dependent> dependents = new ArrayList<>();
		for (int i = 0; i < request.childrenForChildTaxCredit(); i++) {
			dependents.add(new Dependent("child " + (i + 1), true, false));
		}
		for (int i = 0; i < request.otherDependents(); i++) {
			dependents.add(new Dependent("dependent " + (i + 1), false, true));
		}

		List<IncomeRecord> incomes = new ArrayList<>();
		incomes.add(new IncomeRecord.W2Wages("estimate", request.w2Wages(), request.federalWithheld()));
		incomes.add(new IncomeRecord.Other("estimate", request.otherIncome()));
		incomes.add(new IncomeRecord.Tips(request.tipIncome()));
		incomes.add(new IncomeRecord.Overtime(request.overtimeIncome()));
		if (request.selfEmploymentIncome() != null && request.selfEmploymentIncome().signum() != 0) {
			incomes.add(SelfEmploymentLedger.ofNetProfit("estimate", request.selfEmploymentIncome()));
		}

		ItemizedDeductions itemized = null;
		if (request.itemizedDeductions() != null && request.itemizedDeductions().signum() > 0) {
			itemized = new ItemizedDeductions(null, null, null, null, null, null, null, null, null, null, null, null,
					null, request.itemizedDeductions());
		}

		return new TaxReturn(year, status, taxpayer, spouse, dependents, incomes, AdjustmentInputs.none(), itemized,
				TaxCredits.none(), Payments.none());
	}

	private static TaxpayerProfile profileAged(int taxYear, int age) {
		return new TaxpayerProfile(LocalDate.of(taxYear - age, 1, 1), false, null);
	}
}

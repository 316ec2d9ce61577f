package com.example.tax.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.example.tax.domain.model.IncomeRecord.CapitalGains;
import com.example.tax.domain.model.IncomeRecord.Form1099;
import com.example.tax.domain.model.IncomeRecord.W2Wages;
import com.example.tax.domain.service.TaxRounding;

/**
 * Raw input of one federal return. The engine only reads it; derived amounts
 * are returned separately and persisted next to it.
 *
 * spouse and itemizedDeductions are nullable.
 */
public record TaxReturn(
		int taxYear,
		FilingStatus filingStatus,
		TaxpayerProfile taxpayer,
		TaxpayerProfile spouse,
		List<Dependent> dependents,
		List<IncomeRecord> incomes,
		AdjustmentInputs adjustments,
		ItemizedDeductions itemizedDeductions,
		TaxCredits credits,
		Payments payments) {

	public TaxReturn {
		// null elements are kept so validation can report them
		dependents = dependents == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dependents));
		incomes = incomes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(incomes));
		adjustments = Objects.requireNonNullElse(adjustments, AdjustmentInputs.none());
		credits = Objects.requireNonNullElse(credits, TaxCredits.none());
		payments = Objects.requireNonNullElse(payments, Payments.none());
	}

	public boolean hasSpouse() {
		return spouse != null;
	}

	public boolean hasItemizedDeductions() {
		return itemizedDeductions != null;
	}

	public <T extends IncomeRecord> List<T> incomesOf(Class<T> kind) {
		return IncomeRecord.ofKind(incomes, kind);
	}

	public BigDecimal totalW2Wages() {
		return TaxRounding.round(incomesOf(W2Wages.class).stream()
				.map(W2Wages::wages)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	/**
	 * Sum of net profit over every business, losses included.
	 */
	public BigDecimal totalSelfEmploymentProfit() {
		return TaxRounding.round(incomesOf(SelfEmploymentLedger.class).stream()
				.map(SelfEmploymentLedger::netProfit)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalTipIncome() {
		return TaxRounding.round(incomesOf(IncomeRecord.Tips.class).stream()
				.map(IncomeRecord.Tips::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalOvertimeIncome() {
		return TaxRounding.round(incomesOf(IncomeRecord.Overtime.class).stream()
				.map(IncomeRecord.Overtime::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal total1099(Form1099Type formType) {
		return TaxRounding.round(incomesOf(Form1099.class).stream()
				.filter(f -> f.formType() == formType)
				.map(Form1099::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalOther1099() {
		return TaxRounding.round(incomesOf(Form1099.class).stream()
				.filter(f -> f.formType() != Form1099Type.INT && f.formType() != Form1099Type.DIV)
				.map(Form1099::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal shortTermCapitalGains() {
		return TaxRounding.round(incomesOf(CapitalGains.class).stream()
				.map(CapitalGains::shortTerm)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal longTermCapitalGains() {
		return TaxRounding.round(incomesOf(CapitalGains.class).stream()
				.map(CapitalGains::longTerm)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalRentalIncome() {
		return TaxRounding.round(incomesOf(IncomeRecord.Rental.class).stream()
				.map(IncomeRecord.Rental::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalOtherIncome() {
		return TaxRounding.round(incomesOf(IncomeRecord.Other.class).stream()
				.map(IncomeRecord.Other::amount)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	public BigDecimal totalFederalWithheld() {
		BigDecimal w2 = incomesOf(W2Wages.class).stream()
				.map(W2Wages::federalWithheld)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		BigDecimal forms = incomesOf(Form1099.class).stream()
				.map(Form1099::federalWithheld)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		return TaxRounding.round(w2.add(forms));
	}

	public int qualifyingChildrenCount() {
		return (int) dependents.stream().filter(Dependent::qualifiesForChildTaxCredit).count();
	}

	public int otherDependentsCount() {
		return (int) dependents.stream().filter(Dependent::qualifiesForOtherDependentCredit).count();
	}
}

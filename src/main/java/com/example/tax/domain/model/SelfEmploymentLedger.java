package com.example.tax.domain.model;

import java.math.BigDecimal;
import java.util.List;

import com.example.tax.domain.service.TaxRounding;

/**
 * Schedule C style ledger for one business. Net profit may be negative.
 */
public record SelfEmploymentLedger(
		String businessName,
		BigDecimal grossReceipts,
		BigDecimal returnsAndAllowances,
		BigDecimal otherBusinessIncome,
		BigDecimal costOfGoodsSold,
		List<Expense> expenses,
		BigDecimal homeOffice) implements IncomeRecord {

	public record Expense(ExpenseCategory category, BigDecimal amount) {
		public Expense {
			if (category == null)
				throw new IllegalArgumentException("expense category must not be null");
			amount = IncomeRecord.orZero(amount);
		}

		public BigDecimal deductibleAmount() {
			return amount.multiply(category.deductibleShare());
		}
	}

	public SelfEmploymentLedger {
		grossReceipts = IncomeRecord.orZero(grossReceipts);
		returnsAndAllowances = IncomeRecord.orZero(returnsAndAllowances);
		otherBusinessIncome = IncomeRecord.orZero(otherBusinessIncome);
		costOfGoodsSold = IncomeRecord.orZero(costOfGoodsSold);
		expenses = expenses == null ? List.of() : List.copyOf(expenses);
		homeOffice = IncomeRecord.orZero(homeOffice);
	}

	public static SelfEmploymentLedger ofNetProfit(String businessName, BigDecimal netProfit) {
		return new SelfEmploymentLedger(businessName, netProfit, null, null, null, List.of(), null);
	}

	public BigDecimal grossIncome() {
		return TaxRounding.round(grossReceipts
				.subtract(returnsAndAllowances)
				.add(otherBusinessIncome)
				.subtract(costOfGoodsSold));
	}

	public BigDecimal totalExpenses() {
		BigDecimal total = expenses.stream()
				.map(Expense::deductibleAmount)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		return TaxRounding.round(total.add(homeOffice));
	}

	public BigDecimal netProfit() {
		return TaxRounding.round(grossIncome().subtract(totalExpenses()));
	}
}

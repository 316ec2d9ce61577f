package com.example.tax.domain.model;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SelfEmploymentLedgerTest {

	@Test
	@DisplayName("net profit = receipts - returns + other income - COGS - deductible expenses - home office")
	void netProfit_applies_every_ledger_line() {
		var ledger = new SelfEmploymentLedger("Studio", new BigDecimal("50000"), new BigDecimal("1000"),
				new BigDecimal("500"), new BigDecimal("9500"),
				List.of(new SelfEmploymentLedger.Expense(ExpenseCategory.SUPPLIES, new BigDecimal("3000")),
						new SelfEmploymentLedger.Expense(ExpenseCategory.MEALS, new BigDecimal("2000"))),
				new BigDecimal("1500"));

		assertThat(ledger.grossIncome()).isEqualByComparingTo("40000.00");
		// meals count at half
		assertThat(ledger.totalExpenses()).isEqualByComparingTo("5500.00");
		assertThat(ledger.netProfit()).isEqualByComparingTo("34500.00");
	}

	@Test
	void netProfit_may_be_a_loss() {
		var ledger = new SelfEmploymentLedger("Startup", new BigDecimal("1000"), null, null, null,
				List.of(new SelfEmploymentLedger.Expense(ExpenseCategory.ADVERTISING, new BigDecimal("4000"))), null);
		assertThat(ledger.netProfit()).isEqualByComparingTo("-3000.00");
	}

	@Test
	void ofNetProfit_round_trips_the_profit() {
		assertThat(SelfEmploymentLedger.ofNetProfit("Consulting", new BigDecimal("40000")).netProfit())
				.isEqualByComparingTo("40000.00");
	}

	@Test
	void expense_requires_category() {
		assertThatThrownBy(() -> new SelfEmploymentLedger.Expense(null, BigDecimal.TEN))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("category");
	}
}

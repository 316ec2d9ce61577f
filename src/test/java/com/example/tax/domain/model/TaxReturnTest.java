package com.example.tax.domain.model;

import static com.example.tax.TaxReturnFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

class TaxReturnTest {

	@Test
	void missing_sections_default_to_empty_values() {
		var r = new TaxReturn(YEAR, FilingStatus.SINGLE, bornIn(1985), null, null, null, null, null, null, null);

		assertThat(r.dependents()).isEmpty();
		assertThat(r.incomes()).isEmpty();
		assertThat(r.adjustments()).isEqualTo(AdjustmentInputs.none());
		assertThat(r.payments().estimatedPayments()).isEqualByComparingTo("0");
		assertThat(r.hasItemizedDeductions()).isFalse();
		assertThat(r.totalW2Wages()).isEqualByComparingTo("0.00");
	}

	@Test
	void withholding_sums_w2_and_1099_records() {
		var r = single(
				w2("40000", "3000"),
				w2("10000", "500.50"),
				new IncomeRecord.Form1099(Form1099Type.R, "Pension Co", new BigDecimal("5000"), new BigDecimal("250")));

		assertThat(r.totalW2Wages()).isEqualByComparingTo("50000.00");
		assertThat(r.totalFederalWithheld()).isEqualByComparingTo("3750.50");
	}

	@Test
	void other_1099_total_excludes_interest_and_dividends() {
		var r = single(
				new IncomeRecord.Form1099(Form1099Type.INT, "Bank", new BigDecimal("100"), null),
				new IncomeRecord.Form1099(Form1099Type.DIV, "Broker", new BigDecimal("200"), null),
				new IncomeRecord.Form1099(Form1099Type.NEC, "Client", new BigDecimal("300"), null),
				new IncomeRecord.Form1099(null, "Unknown", new BigDecimal("400"), null));

		assertThat(r.total1099(Form1099Type.INT)).isEqualByComparingTo("100");
		assertThat(r.totalOther1099()).isEqualByComparingTo("700");
	}

	@Test
	void dependent_counts_follow_the_flags() {
		var r = taxReturn(FilingStatus.HEAD_OF_HOUSEHOLD, List.of(
				new Dependent("a", true, false),
				new Dependent("b", true, false),
				new Dependent("c", false, true),
				new Dependent("d", false, false)));

		assertThat(r.qualifyingChildrenCount()).isEqualTo(2);
		assertThat(r.otherDependentsCount()).isEqualTo(1);
	}

	@Test
	void incomes_are_read_only() {
		var r = single(w2("1", "0"));
		assertThatThrownBy(() -> r.incomes().add(new IncomeRecord.Tips(BigDecimal.ONE)))
				.isInstanceOf(UnsupportedOperationException.class);
	}
}

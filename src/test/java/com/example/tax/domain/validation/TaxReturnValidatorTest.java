package com.example.tax.domain.validation;

import static com.example.tax.TaxReturnFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.Form1099Type;
import com.example.tax.domain.model.IncomeRecord;
import com.example.tax.domain.model.Payments;
import com.example.tax.domain.model.TaxReturn;

class TaxReturnValidatorTest {

	@Test
	void accepts_a_plain_return() {
		assertThatCode(() -> TaxReturnValidator.validate(single(w2("50000", "6000")))).doesNotThrowAnyException();
	}

	@Test
	void rejects_null_return() {
		assertThatThrownBy(() -> TaxReturnValidator.validate(null))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("must not be null");
	}

	@Test
	void rejects_missing_filing_status() {
		var r = new TaxReturn(YEAR, null, bornIn(1985), null, null, null, null, null, null, null);
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("filing status");
	}

	@Test
	void rejects_missing_taxpayer() {
		var r = new TaxReturn(YEAR, FilingStatus.SINGLE, null, null, null, null, null, null, null, null);
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("taxpayer");
	}

	@Test
	@DisplayName("a joint return needs a spouse profile")
	void rejects_joint_without_spouse() {
		var r = withTaxpayer(taxReturn(FilingStatus.MARRIED_JOINT, List.of()), bornIn(1985), null);
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("requires a spouse");
	}

	@Test
	void separate_filers_need_no_spouse() {
		assertThatCode(() -> TaxReturnValidator.validate(taxReturn(FilingStatus.MARRIED_SEPARATE, List.of())))
				.doesNotThrowAnyException();
	}

	@Test
	void rejects_null_income_record() {
		var r = withIncomes(single(), Arrays.<IncomeRecord>asList(w2("100", "0"), null));
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("income records");
	}

	@Test
	void rejects_negative_w2_withholding() {
		assertThatThrownBy(() -> TaxReturnValidator.validate(single(w2("50000", "-1"))))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("W-2 federal withholding");
	}

	@Test
	void rejects_negative_1099_withholding_by_form_name() {
		var r = single(new IncomeRecord.Form1099(Form1099Type.NEC, "Client", new BigDecimal("100"),
				new BigDecimal("-5")));
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("1099-NEC");
	}

	@Test
	void rejects_negative_estimated_payments() {
		var r = withPayments(single(), new Payments(new BigDecimal("-100"), null));
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("estimated payments");
	}

	@Test
	void rejects_negative_adjustment_input() {
		var r = withAdjustments(single(), new AdjustmentInputs(null, null, null, null, null, new BigDecimal("-1")));
		assertThatThrownBy(() -> TaxReturnValidator.validate(r))
				.isInstanceOf(InvalidTaxReturnException.class)
				.hasMessageContaining("IRA");
	}
}

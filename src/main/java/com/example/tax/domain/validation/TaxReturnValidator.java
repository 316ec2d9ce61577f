package com.example.tax.domain.validation;

import java.math.BigDecimal;
import java.util.Objects;

import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.IncomeRecord;
import com.example.tax.domain.model.TaxReturn;

public class TaxReturnValidator {
	private TaxReturnValidator() {
	}

	public static void validate(TaxReturn taxReturn) {
		if (taxReturn == null)
			throw new InvalidTaxReturnException("tax return must not be null");
		if (taxReturn.filingStatus() == null)
			throw new InvalidTaxReturnException("filing status must not be null");
		if (taxReturn.taxpayer() == null)
			throw new InvalidTaxReturnException("taxpayer profile must not be null");
		if (taxReturn.filingStatus().requiresSpouse() && !taxReturn.hasSpouse())
			throw new InvalidTaxReturnException("filing status " + taxReturn.filingStatus() + " requires a spouse profile");

		if (taxReturn.dependents().stream().anyMatch(Objects::isNull))
			throw new InvalidTaxReturnException("dependents must not contain null");
		for (IncomeRecord income : taxReturn.incomes()) {
			if (income == null)
				throw new InvalidTaxReturnException("income records must not contain null");
			if (income instanceof IncomeRecord.W2Wages w2)
				requireNonNegative(w2.federalWithheld(), "W-2 federal withholding");
			if (income instanceof IncomeRecord.Form1099 form)
				requireNonNegative(form.federalWithheld(), form.formType().formName() + " federal withholding");
		}

		requireNonNegative(taxReturn.payments().estimatedPayments(), "estimated payments");
		requireNonNegative(taxReturn.payments().extensionPayment(), "extension payment");

		AdjustmentInputs adjustments = taxReturn.adjustments();
		requireNonNegative(adjustments.educatorExpenses(), "educator expenses");
		requireNonNegative(adjustments.hsaDeduction(), "HSA deduction");
		requireNonNegative(adjustments.selfEmployedHealthInsurance(), "self-employed health insurance");
		requireNonNegative(adjustments.sepSimpleContributions(), "SEP/SIMPLE contributions");
		requireNonNegative(adjustments.studentLoanInterest(), "student loan interest");
		requireNonNegative(adjustments.iraDeduction(), "IRA deduction");
	}

	private static void requireNonNegative(BigDecimal amount, String name) {
		if (amount.signum() < 0)
			throw new InvalidTaxReturnException(name + " must be >= 0");
	}
}

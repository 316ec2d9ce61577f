package com.example.tax.domain.policy.adjustment;

import java.math.BigDecimal;

import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;
import com.example.tax.domain.service.SelfEmploymentTaxCalculator;

public class SelfEmploymentTaxAdjustment implements AdjustmentPolicy {
	private final SelfEmploymentTaxCalculator selfEmploymentTax;

	public SelfEmploymentTaxAdjustment(SelfEmploymentTaxCalculator selfEmploymentTax) {
		this.selfEmploymentTax = selfEmploymentTax;
	}

	@Override
	public BigDecimal amount(TaxReturn taxReturn, BigDecimal grossIncome) {
		return selfEmploymentTax.deductiblePortion(taxReturn);
	}

	@Override
	public AdjustmentType type() {
		return AdjustmentType.SELF_EMPLOYMENT_TAX;
	}
}

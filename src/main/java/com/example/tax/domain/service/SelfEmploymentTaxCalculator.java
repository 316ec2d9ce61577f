package com.example.tax.domain.service;

import java.math.BigDecimal;

import com.example.tax.domain.config.SelfEmploymentTaxRules;
import com.example.tax.domain.model.TaxReturn;

/**
 * Social Security and Medicare on self-employment earnings. Used both for the
 * liability and for the half deducted above the line.
 */
public class SelfEmploymentTaxCalculator {
	private final SelfEmploymentTaxRules rules;

	public SelfEmploymentTaxCalculator(SelfEmploymentTaxRules rules) {
		this.rules = rules;
	}

	public BigDecimal selfEmploymentTax(TaxReturn taxReturn) {
		return selfEmploymentTax(taxReturn.totalSelfEmploymentProfit());
	}

	public BigDecimal selfEmploymentTax(BigDecimal netProfit) {
		if (netProfit.signum() <= 0)
			return TaxRounding.zero();

		BigDecimal netEarnings = TaxRounding.round(netProfit.multiply(rules.netEarningsFactor()));
		BigDecimal socialSecurity = TaxRounding.round(
				netEarnings.min(rules.socialSecurityWageBase()).multiply(rules.socialSecurityRate()));
		// no wage base cap on the Medicare portion
		BigDecimal medicare = TaxRounding.round(netEarnings.multiply(rules.medicareRate()));
		return TaxRounding.round(socialSecurity.add(medicare));
	}

	public BigDecimal deductiblePortion(TaxReturn taxReturn) {
		return TaxRounding.round(selfEmploymentTax(taxReturn).multiply(rules.deductibleShare()));
	}
}

package com.example.tax.domain.service;

import java.math.BigDecimal;

import com.example.tax.domain.model.Settlement;
import com.example.tax.domain.model.TaxReturn;

public class SettlementCalculator {

	/**
	 * Withholding, estimated and extension payments, plus refundable credits.
	 */
	public BigDecimal totalPayments(TaxReturn taxReturn, BigDecimal refundableCredits) {
		return TaxRounding.round(taxReturn.totalFederalWithheld()
				.add(taxReturn.payments().estimatedPayments())
				.add(taxReturn.payments().extensionPayment())
				.add(refundableCredits));
	}

	public Settlement settle(BigDecimal taxAfterNonrefundableCredits, BigDecimal totalPayments) {
		BigDecimal balance = totalPayments.subtract(taxAfterNonrefundableCredits);
		if (balance.signum() >= 0) {
			return new Settlement(TaxRounding.round(balance), TaxRounding.zero());
		}
		return new Settlement(TaxRounding.zero(), TaxRounding.round(balance.negate()));
	}
}

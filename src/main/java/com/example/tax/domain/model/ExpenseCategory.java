package com.example.tax.domain.model;

import java.math.BigDecimal;

public enum ExpenseCategory {
	ADVERTISING,
	CAR_AND_TRUCK,
	COMMISSIONS,
	CONTRACT_LABOR,
	DEPRECIATION,
	INSURANCE,
	INTEREST,
	LEGAL_AND_PROFESSIONAL,
	OFFICE,
	RENT_OR_LEASE,
	REPAIRS,
	SUPPLIES,
	TAXES_AND_LICENSES,
	TRAVEL,
	MEALS(new BigDecimal("0.50")),
	UTILITIES,
	WAGES,
	OTHER;

	private final BigDecimal deductibleShare;

	ExpenseCategory() {
		this(BigDecimal.ONE);
	}

	ExpenseCategory(BigDecimal deductibleShare) {
		this.deductibleShare = deductibleShare;
	}

	public BigDecimal deductibleShare() {
		return deductibleShare;
	}
}

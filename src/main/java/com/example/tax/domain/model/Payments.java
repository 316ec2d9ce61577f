package com.example.tax.domain.model;

import static com.example.tax.domain.model.IncomeRecord.orZero;

import java.math.BigDecimal;

// withholding is carried on the W-2 and 1099 records themselves
public record Payments(BigDecimal estimatedPayments, BigDecimal extensionPayment) {

	public Payments {
		estimatedPayments = orZero(estimatedPayments);
		extensionPayment = orZero(extensionPayment);
	}

	public static Payments none() {
		return new Payments(null, null);
	}
}

package com.example.tax.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point rounding applied to every derived money amount: two decimal
 * places, half-up.
 */
public final class TaxRounding {
	public static final int SCALE = 2;

	private TaxRounding() {
	}

	public static BigDecimal round(BigDecimal amount) {
		if (amount == null)
			throw new IllegalArgumentException("amount must not be null");
		return amount.setScale(SCALE, RoundingMode.HALF_UP);
	}

	public static BigDecimal zero() {
		return BigDecimal.ZERO.setScale(SCALE);
	}

	public static BigDecimal nonNegative(BigDecimal amount) {
		return round(amount.max(BigDecimal.ZERO));
	}
}

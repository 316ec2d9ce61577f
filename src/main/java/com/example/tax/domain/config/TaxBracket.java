package com.example.tax.domain.config;

import java.math.BigDecimal;

/**
 * One step of a progressive schedule. A null upperBound marks the terminal,
 * unbounded bracket.
 */
public record TaxBracket(BigDecimal upperBound, BigDecimal rate) {

	public TaxBracket {
		if (rate == null)
			throw new IllegalArgumentException("rate must not be null");
	}

	public static TaxBracket upTo(String upperBound, String rate) {
		return new TaxBracket(new BigDecimal(upperBound), new BigDecimal(rate));
	}

	public static TaxBracket above(String rate) {
		return new TaxBracket(null, new BigDecimal(rate));
	}

	public boolean isTerminal() {
		return upperBound == null;
	}

	// the slice of income that falls at or below this bracket's ceiling
	public BigDecimal cap(BigDecimal income) {
		return isTerminal() ? income : income.min(upperBound);
	}
}

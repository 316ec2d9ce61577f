package com.example.tax.domain.model;

import java.math.BigDecimal;

// refundable never exceeds total
public record ChildTaxCredit(BigDecimal total, BigDecimal refundable) {

	public BigDecimal nonrefundable() {
		return total.subtract(refundable);
	}
}

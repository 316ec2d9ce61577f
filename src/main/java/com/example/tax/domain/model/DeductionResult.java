package com.example.tax.domain.model;

import java.math.BigDecimal;

/**
 * The chosen deduction plus both candidates it was chosen from. itemizedAmount
 * is zero when no itemized deductions were supplied.
 */
public record DeductionResult(BigDecimal amount, DeductionKind kind, BigDecimal standardAmount,
		BigDecimal itemizedAmount) {
}

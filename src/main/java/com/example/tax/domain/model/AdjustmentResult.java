package com.example.tax.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Above-the-line adjustments. applied lists, in evaluation order, the
 * adjustments that produced a non-zero amount.
 */
public record AdjustmentResult(BigDecimal total, Map<AdjustmentType, BigDecimal> amounts, List<AdjustmentType> applied) {

	public AdjustmentResult {
		amounts = amounts.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(amounts));
		applied = List.copyOf(applied);
	}

	public BigDecimal amountOf(AdjustmentType type) {
		return amounts.getOrDefault(type, BigDecimal.ZERO.setScale(2));
	}
}

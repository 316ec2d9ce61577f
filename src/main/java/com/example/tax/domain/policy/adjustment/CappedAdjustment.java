package com.example.tax.domain.policy.adjustment;

import java.math.BigDecimal;
import java.util.function.Function;

import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;
import com.example.tax.domain.service.TaxRounding;

/**
 * A caller-entered adjustment taken as is, optionally limited to a fixed cap.
 */
public class CappedAdjustment implements AdjustmentPolicy {
	private final AdjustmentType type;
	private final Function<AdjustmentInputs, BigDecimal> source;
	private final BigDecimal cap; // null: uncapped

	public CappedAdjustment(AdjustmentType type, Function<AdjustmentInputs, BigDecimal> source, BigDecimal cap) {
		this.type = type;
		this.source = source;
		this.cap = cap;
	}

	public static CappedAdjustment uncapped(AdjustmentType type, Function<AdjustmentInputs, BigDecimal> source) {
		return new CappedAdjustment(type, source, null);
	}

	@Override
	public BigDecimal amount(TaxReturn taxReturn, BigDecimal grossIncome) {
		BigDecimal entered = source.apply(taxReturn.adjustments());
		return TaxRounding.round(cap == null ? entered : entered.min(cap));
	}

	@Override
	public AdjustmentType type() {
		return type;
	}
}

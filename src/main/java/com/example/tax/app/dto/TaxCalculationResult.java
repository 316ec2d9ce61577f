package com.example.tax.app.dto;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.CreditSummary;
import com.example.tax.domain.model.DeductionKind;
import com.example.tax.domain.model.LiabilityBreakdown;

public record TaxCalculationResult(
		int taxYear,
		BigDecimal grossIncome,
		BigDecimal adjustments,
		BigDecimal adjustedGrossIncome,
		BigDecimal deductionAmount,
		DeductionKind deductionKind,
		BigDecimal qbiDeduction,
		BigDecimal taxableIncome,
		BigDecimal taxLiability,
		BigDecimal totalNonrefundableCredits,
		BigDecimal totalRefundableCredits,
		BigDecimal taxAfterCredits,
		BigDecimal totalPayments,
		BigDecimal federalWithheld,
		BigDecimal estimatedPayments,
		BigDecimal refundAmount,
		BigDecimal amountOwed,
		BigDecimal tipsDeduction,
		BigDecimal overtimeDeduction,
		BigDecimal childTaxCredit,
		List<AdjustmentType> appliedAdjustments,
		LiabilityBreakdown liability,
		CreditSummary credits) {

	public TaxCalculationResult {
		appliedAdjustments = List.copyOf(appliedAdjustments);
	}

	/**
	 * Flat, ordered view for the e-file builder and response serialization.
	 * Values are BigDecimal except deductionKind, which is its code string.
	 */
	public Map<String, Object> toFieldMap() {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("grossIncome", grossIncome);
		fields.put("adjustments", adjustments);
		fields.put("adjustedGrossIncome", adjustedGrossIncome);
		fields.put("deductionAmount", deductionAmount);
		fields.put("deductionKind", deductionKind.code());
		fields.put("qbiDeduction", qbiDeduction);
		fields.put("taxableIncome", taxableIncome);
		fields.put("taxLiability", taxLiability);
		fields.put("totalNonrefundableCredits", totalNonrefundableCredits);
		fields.put("totalRefundableCredits", totalRefundableCredits);
		fields.put("taxAfterCredits", taxAfterCredits);
		fields.put("totalPayments", totalPayments);
		fields.put("federalWithheld", federalWithheld);
		fields.put("estimatedPayments", estimatedPayments);
		fields.put("refundAmount", refundAmount);
		fields.put("amountOwed", amountOwed);
		fields.put("tipsDeduction", tipsDeduction);
		fields.put("overtimeDeduction", overtimeDeduction);
		fields.put("childTaxCredit", childTaxCredit);
		return Collections.unmodifiableMap(fields);
	}
}

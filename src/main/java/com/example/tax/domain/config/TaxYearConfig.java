package com.example.tax.domain.config;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.FilingStatus;

/**
 * Every rate, threshold and cap the engine needs for one tax year. Built once
 * when the year is loaded and shared read-only between calculations.
 */
public record TaxYearConfig(
		int taxYear,
		Map<FilingStatus, List<TaxBracket>> brackets,
		DeductionRules deductions,
		AdjustmentRules adjustments,
		SelfEmploymentTaxRules selfEmployment,
		SurtaxRules surtaxes,
		CreditRules credits) {

	public TaxYearConfig {
		EnumMap<FilingStatus, List<TaxBracket>> copy = new EnumMap<>(FilingStatus.class);
		for (FilingStatus status : FilingStatus.values()) {
			List<TaxBracket> schedule = brackets.get(status);
			if (schedule == null || schedule.isEmpty())
				throw new TaxConfigurationException("tax year " + taxYear + " has no brackets for " + status);
			if (!schedule.get(schedule.size() - 1).isTerminal())
				throw new TaxConfigurationException(
						"tax year " + taxYear + " brackets for " + status + " must end with an unbounded bracket");
			copy.put(status, List.copyOf(schedule));
		}
		brackets = Collections.unmodifiableMap(copy);
	}

	public List<TaxBracket> bracketsFor(FilingStatus status) {
		return brackets.get(status);
	}

	public BigDecimal standardDeductionFor(FilingStatus status) {
		return deductions.standardDeduction().get(status);
	}
}

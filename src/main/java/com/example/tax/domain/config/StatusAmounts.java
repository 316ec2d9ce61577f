package com.example.tax.domain.config;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.FilingStatus;

/**
 * An amount per filing status, complete for every constant of the enum.
 */
public final class StatusAmounts {
	private final Map<FilingStatus, BigDecimal> amounts;

	private StatusAmounts(Map<FilingStatus, BigDecimal> amounts) {
		this.amounts = amounts;
	}

	public static StatusAmounts of(String name, Map<FilingStatus, BigDecimal> source) {
		EnumMap<FilingStatus, BigDecimal> copy = new EnumMap<>(FilingStatus.class);
		for (FilingStatus status : FilingStatus.values()) {
			BigDecimal amount = source.get(status);
			if (amount == null)
				throw new TaxConfigurationException(name + " has no entry for " + status);
			copy.put(status, amount);
		}
		return new StatusAmounts(Collections.unmodifiableMap(copy));
	}

	public BigDecimal get(FilingStatus status) {
		return amounts.get(status);
	}

	@Override
	public String toString() {
		return amounts.toString();
	}
}

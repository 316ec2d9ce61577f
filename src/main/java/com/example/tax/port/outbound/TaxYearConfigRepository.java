package com.example.tax.port.outbound;

import java.util.Optional;
import java.util.Set;

import com.example.tax.domain.config.TaxYearConfig;

public interface TaxYearConfigRepository {
	Optional<TaxYearConfig> findByYear(int taxYear);

	Set<Integer> supportedYears();

	/** Year used when a caller does not name one; always among {@link #supportedYears()}. */
	int defaultYear();
}

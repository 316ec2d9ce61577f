package com.example.tax.domain.config;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.FilingStatus;

class TaxYearConfigTest {

	private static Map<FilingStatus, List<TaxBracket>> allStatuses(List<TaxBracket> schedule) {
		Map<FilingStatus, List<TaxBracket>> brackets = new EnumMap<>(FilingStatus.class);
		for (FilingStatus status : FilingStatus.values()) {
			brackets.put(status, schedule);
		}
		return brackets;
	}

	@Test
	void accepts_schedule_ending_in_unbounded_bracket() {
		var config = new TaxYearConfig(2025,
				allStatuses(List.of(TaxBracket.upTo("10000", "0.10"), TaxBracket.above("0.20"))),
				null, null, null, null, null);
		assertThat(config.bracketsFor(FilingStatus.SINGLE)).hasSize(2);
		assertThat(config.bracketsFor(FilingStatus.SINGLE).get(1).isTerminal()).isTrue();
	}

	@Test
	void rejects_schedule_without_unbounded_bracket() {
		assertThatThrownBy(() -> new TaxYearConfig(2025, allStatuses(List.of(TaxBracket.upTo("10000", "0.10"))),
				null, null, null, null, null))
				.isInstanceOf(TaxConfigurationException.class)
				.hasMessageContaining("must end with an unbounded bracket");
	}

	@Test
	void rejects_missing_status() {
		var brackets = allStatuses(List.of(TaxBracket.above("0.10")));
		brackets.remove(FilingStatus.HEAD_OF_HOUSEHOLD);
		assertThatThrownBy(() -> new TaxYearConfig(2025, brackets, null, null, null, null, null))
				.isInstanceOf(TaxConfigurationException.class)
				.hasMessageContaining("no brackets for HEAD_OF_HOUSEHOLD");
	}

	@Test
	void status_amounts_require_every_status() {
		Map<FilingStatus, BigDecimal> partial = new EnumMap<>(FilingStatus.class);
		partial.put(FilingStatus.SINGLE, BigDecimal.ONE);
		assertThatThrownBy(() -> StatusAmounts.of("standard", partial))
				.isInstanceOf(TaxConfigurationException.class)
				.hasMessageContaining("standard has no entry for MARRIED_JOINT");
	}

	@Test
	void bracket_cap_limits_income_to_upper_bound() {
		assertThat(TaxBracket.upTo("10000", "0.10").cap(new BigDecimal("25000"))).isEqualByComparingTo("10000");
		assertThat(TaxBracket.above("0.37").cap(new BigDecimal("25000"))).isEqualByComparingTo("25000");
	}
}

package com.example.tax.domain.model;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class TaxpayerProfileTest {

	@Test
	void age_counts_a_birthday_on_december_31() {
		assertThat(new TaxpayerProfile(LocalDate.of(1960, 12, 31), false, null).ageAtYearEnd(2025)).isEqualTo(65);
	}

	@Test
	void age_excludes_a_birthday_in_the_following_year() {
		assertThat(new TaxpayerProfile(LocalDate.of(1961, 1, 1), false, null).ageAtYearEnd(2025)).isEqualTo(64);
	}

	@Test
	void birthDate_is_required() {
		assertThatThrownBy(() -> new TaxpayerProfile(null, true, "nurse"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("birthDate");
	}
}

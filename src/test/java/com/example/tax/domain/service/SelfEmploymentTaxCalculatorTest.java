package com.example.tax.domain.service;

import static com.example.tax.TaxReturnFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.example.tax.domain.model.SelfEmploymentLedger;

class SelfEmploymentTaxCalculatorTest {
	private final SelfEmploymentTaxCalculator sut = new SelfEmploymentTaxCalculator(config2025().selfEmployment());

	@Test
	@Tag("anchor")
	void tax_on_40000_profit() {
		// 36940.00 net earnings: 4580.56 social security + 1071.26 medicare
		assertThat(sut.selfEmploymentTax(new BigDecimal("40000"))).isEqualByComparingTo("5651.82");
	}

	@Test
	void deductible_portion_is_half() {
		var r = single(SelfEmploymentLedger.ofNetProfit("Consulting", new BigDecimal("40000")));
		assertThat(sut.deductiblePortion(r)).isEqualByComparingTo("2825.91");
	}

	@Test
	void social_security_stops_at_wage_base() {
		// 184700.00 net earnings: 168600 x 12.4% = 20906.40, medicare uncapped 5356.30
		assertThat(sut.selfEmploymentTax(new BigDecimal("200000"))).isEqualByComparingTo("26262.70");
	}

	@Test
	void no_tax_on_loss_or_zero() {
		assertThat(sut.selfEmploymentTax(new BigDecimal("-5000"))).isEqualByComparingTo("0.00");
		assertThat(sut.selfEmploymentTax(BigDecimal.ZERO)).isEqualByComparingTo("0.00");
	}
}

package com.example.tax.domain.service;

import static com.example.tax.TaxReturnFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.tax.domain.model.AdjustmentInputs;
import com.example.tax.domain.model.AdjustmentType;
import com.example.tax.domain.model.SelfEmploymentLedger;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.policy.AdjustmentPolicy;

@ExtendWith(MockitoExtension.class)
class AdjustmentCalculatorTest {

	@Nested
	class InjectedPolicies {
		@Mock
		AdjustmentPolicy first;
		@Mock
		AdjustmentPolicy second;

		@Test
		@DisplayName("policies run in order and only non-zero amounts are reported as applied")
		void applied_lists_non_zero_in_order() {
			TaxReturn r = single(w2("50000", "0"));
			BigDecimal gross = new BigDecimal("50000.00");
			when(first.amount(r, gross)).thenReturn(new BigDecimal("0.00"));
			when(first.type()).thenReturn(AdjustmentType.HSA);
			when(second.amount(r, gross)).thenReturn(new BigDecimal("250.00"));
			when(second.type()).thenReturn(AdjustmentType.IRA);

			var result = new AdjustmentCalculator(List.of(first, second)).calculate(r, gross);

			assertThat(result.total()).isEqualByComparingTo("250.00");
			assertThat(result.applied()).containsExactly(AdjustmentType.IRA);
			assertThat(result.amountOf(AdjustmentType.HSA)).isEqualByComparingTo("0.00");
			InOrder io = inOrder(first, second);
			io.verify(first).amount(r, gross);
			io.verify(second).amount(r, gross);
		}

		@Test
		void injected_list_is_copied() {
			List<AdjustmentPolicy> policies = new ArrayList<>(List.of(first));
			var sut = new AdjustmentCalculator(policies);
			policies.add(second);
			when(first.amount(any(), any())).thenReturn(new BigDecimal("10.00"));
			when(first.type()).thenReturn(AdjustmentType.HSA);

			sut.calculate(single(), BigDecimal.ZERO);

			verifyNoInteractions(second);
		}
	}

	@Nested
	class DefaultPolicies {
		private final AdjustmentCalculator sut = new AdjustmentCalculator(config2025().adjustments(),
				new SelfEmploymentTaxCalculator(config2025().selfEmployment()));

		@Test
		void caps_educator_and_student_loan_interest() {
			TaxReturn r = withAdjustments(single(w2("60000", "0")), new AdjustmentInputs(
					new BigDecimal("500"), new BigDecimal("1000"), null, null, new BigDecimal("3000"),
					new BigDecimal("2000")));

			var result = sut.calculate(r, new BigDecimal("60000.00"));

			assertThat(result.amountOf(AdjustmentType.EDUCATOR_EXPENSES)).isEqualByComparingTo("300.00");
			assertThat(result.amountOf(AdjustmentType.STUDENT_LOAN_INTEREST)).isEqualByComparingTo("2500.00");
			assertThat(result.total()).isEqualByComparingTo("5800.00");
			assertThat(result.applied()).containsExactly(AdjustmentType.EDUCATOR_EXPENSES, AdjustmentType.HSA,
					AdjustmentType.STUDENT_LOAN_INTEREST, AdjustmentType.IRA);
		}

		@Test
		void includes_half_of_self_employment_tax() {
			TaxReturn r = single(SelfEmploymentLedger.ofNetProfit("Consulting", new BigDecimal("40000")));

			var result = sut.calculate(r, new BigDecimal("40000.00"));

			assertThat(result.total()).isEqualByComparingTo("2825.91");
			assertThat(result.applied()).containsExactly(AdjustmentType.SELF_EMPLOYMENT_TAX);
		}
	}
}

package com.example.tax.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * One income source on a return. Each kind is a separate record so the
 * aggregator can pick them apart by type.
 */
public sealed interface IncomeRecord permits IncomeRecord.W2Wages, IncomeRecord.Form1099, SelfEmploymentLedger,
		IncomeRecord.Tips, IncomeRecord.Overtime, IncomeRecord.CapitalGains, IncomeRecord.Rental,
		IncomeRecord.SocialSecurityBenefits, IncomeRecord.Other {

	record W2Wages(String employerName, BigDecimal wages, BigDecimal federalWithheld) implements IncomeRecord {
		public W2Wages {
			wages = orZero(wages);
			federalWithheld = orZero(federalWithheld);
		}
	}

	record Form1099(Form1099Type formType, String payerName, BigDecimal amount, BigDecimal federalWithheld)
			implements IncomeRecord {
		public Form1099 {
			formType = Objects.requireNonNullElse(formType, Form1099Type.OTHER);
			amount = orZero(amount);
			federalWithheld = orZero(federalWithheld);
		}
	}

	record Tips(BigDecimal amount) implements IncomeRecord {
		public Tips {
			amount = orZero(amount);
		}
	}

	record Overtime(BigDecimal amount) implements IncomeRecord {
		public Overtime {
			amount = orZero(amount);
		}
	}

	// either side may be a loss
	record CapitalGains(BigDecimal shortTerm, BigDecimal longTerm) implements IncomeRecord {
		public CapitalGains {
			shortTerm = orZero(shortTerm);
			longTerm = orZero(longTerm);
		}
	}

	record Rental(BigDecimal amount) implements IncomeRecord {
		public Rental {
			amount = orZero(amount);
		}
	}

	record SocialSecurityBenefits(BigDecimal amount) implements IncomeRecord {
		public SocialSecurityBenefits {
			amount = orZero(amount);
		}
	}

	record Other(String description, BigDecimal amount) implements IncomeRecord {
		public Other {
			amount = orZero(amount);
		}
	}

	static BigDecimal orZero(BigDecimal amount) {
		return amount != null ? amount : BigDecimal.ZERO;
	}

	static <T extends IncomeRecord> List<T> ofKind(List<IncomeRecord> incomes, Class<T> kind) {
		return incomes.stream().filter(kind::isInstance).map(kind::cast).toList();
	}
}

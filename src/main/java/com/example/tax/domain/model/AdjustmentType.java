package com.example.tax.domain.model;

public enum AdjustmentType {
	EDUCATOR_EXPENSES,
	HSA,
	SELF_EMPLOYMENT_TAX,
	SELF_EMPLOYED_HEALTH_INSURANCE,
	SEP_SIMPLE,
	STUDENT_LOAN_INTEREST,
	IRA,
	TIPS,
	OVERTIME
}

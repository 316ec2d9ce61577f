package com.example.tax.app.dto;

public enum PayFrequency {
	WEEKLY(52),
	BIWEEKLY(26),
	SEMIMONTHLY(24),
	MONTHLY(12);

	private final int periodsPerYear;

	PayFrequency(int periodsPerYear) {
		this.periodsPerYear = periodsPerYear;
	}

	public int periodsPerYear() {
		return periodsPerYear;
	}
}

package com.example.tax.domain.model;

import java.time.LocalDate;
import java.time.Period;

/**
 * Personal attributes of a filer or spouse that drive deduction add-ons.
 * occupation is free text and never enters the arithmetic.
 */
public record TaxpayerProfile(LocalDate birthDate, boolean blind, String occupation) {

	public TaxpayerProfile {
		if (birthDate == null)
			throw new IllegalArgumentException("birthDate must not be null");
	}

	/**
	 * Completed years of age on December 31 of the given tax year.
	 */
	public int ageAtYearEnd(int taxYear) {
		return Period.between(birthDate, LocalDate.of(taxYear, 12, 31)).getYears();
	}
}

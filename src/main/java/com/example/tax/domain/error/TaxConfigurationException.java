package com.example.tax.domain.error;

/**
 * Rate tables for a tax year are missing, unsupported or malformed. Raised
 * before any computation starts.
 */
public class TaxConfigurationException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public TaxConfigurationException(String message) {
		super(message);
	}

	public TaxConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

	public static TaxConfigurationException unsupportedYear(int taxYear) {
		return new TaxConfigurationException("unsupported tax year: " + taxYear);
	}
}

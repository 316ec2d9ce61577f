package com.example.tax.domain.error;

/**
 * The return is structurally impossible to compute (negative withholding,
 * missing spouse on a joint return, ...). No partial result is produced.
 */
public class InvalidTaxReturnException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public InvalidTaxReturnException(String message) {
		super(message);
	}
}

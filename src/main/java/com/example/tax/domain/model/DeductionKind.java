package com.example.tax.domain.model;

public enum DeductionKind {
	STANDARD("standard"),
	ITEMIZED("itemized");

	private final String code;

	DeductionKind(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}
}

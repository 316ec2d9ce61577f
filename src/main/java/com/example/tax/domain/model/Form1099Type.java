package com.example.tax.domain.model;

public enum Form1099Type {
	INT("1099-INT"),
	DIV("1099-DIV"),
	NEC("1099-NEC"),
	MISC("1099-MISC"),
	B("1099-B"),
	R("1099-R"),
	G("1099-G"),
	K("1099-K"),
	OTHER("1099");

	private final String formName;

	Form1099Type(String formName) {
		this.formName = formName;
	}

	public String formName() {
		return formName;
	}
}

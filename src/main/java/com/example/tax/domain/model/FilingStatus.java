package com.example.tax.domain.model;

public enum FilingStatus {
	SINGLE,
	MARRIED_JOINT,
	MARRIED_SEPARATE,
	HEAD_OF_HOUSEHOLD,
	QUALIFYING_WIDOW;

	public boolean requiresSpouse() {
		return this == MARRIED_JOINT;
	}
}

package com.example.tax.domain.model;

// credit eligibility is decided upstream, the engine only counts the flags
public record Dependent(String name, boolean qualifiesForChildTaxCredit, boolean qualifiesForOtherDependentCredit) {
}

package com.example.tax.domain.model;

import java.math.BigDecimal;

// end is null for the unbounded top bracket
public record BracketSlice(BigDecimal start, BigDecimal end, BigDecimal rate, BigDecimal taxInBracket) {
}

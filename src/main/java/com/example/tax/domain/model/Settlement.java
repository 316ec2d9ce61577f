package com.example.tax.domain.model;

import java.math.BigDecimal;

// at most one side is non-zero
public record Settlement(BigDecimal refund, BigDecimal owed) {
}

package com.example.tax.domain.config;

import java.math.BigDecimal;

public record EarnedIncomeCreditRow(BigDecimal maxAgi, BigDecimal maxCredit) {
}

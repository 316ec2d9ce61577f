package com.example.tax.domain.service;

import java.math.BigDecimal;
import java.util.List;

import com.example.tax.domain.model.Form1099Type;
import com.example.tax.domain.model.TaxReturn;

/**
 * Gross income over every source on the return. Absent sources contribute
 * zero. Social Security benefits are exempt and never added.
 */
public class IncomeAggregator {

	public BigDecimal grossIncome(TaxReturn taxReturn) {
		List<BigDecimal> components = List.of(
				taxReturn.totalW2Wages(),
				taxReturn.totalSelfEmploymentProfit(),
				taxReturn.totalTipIncome(),
				taxReturn.totalOvertimeIncome(),
				taxReturn.total1099(Form1099Type.INT),
				taxReturn.total1099(Form1099Type.DIV),
				taxReturn.totalOther1099(),
				taxReturn.shortTermCapitalGains(),
				taxReturn.longTermCapitalGains(),
				taxReturn.totalRentalIncome(),
				taxReturn.totalOtherIncome());
		return TaxRounding.round(components.stream().reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	/**
	 * Interest, dividends, both capital gain components and rental income; the
	 * base of the net investment income tax.
	 */
	public BigDecimal investmentIncome(TaxReturn taxReturn) {
		return TaxRounding.round(taxReturn.total1099(Form1099Type.INT)
				.add(taxReturn.total1099(Form1099Type.DIV))
				.add(taxReturn.shortTermCapitalGains())
				.add(taxReturn.longTermCapitalGains())
				.add(taxReturn.totalRentalIncome()));
	}
}

package com.example.tax.domain.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.example.tax.domain.config.SurtaxRules;
import com.example.tax.domain.config.TaxBracket;
import com.example.tax.domain.config.TaxYearConfig;
import com.example.tax.domain.model.BracketSlice;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.LiabilityBreakdown;
import com.example.tax.domain.model.TaxReturn;

public class TaxLiabilityCalculator {
	private final TaxYearConfig config;
	private final SelfEmploymentTaxCalculator selfEmploymentTax;
	private final IncomeAggregator incomes;

	public TaxLiabilityCalculator(TaxYearConfig config, SelfEmploymentTaxCalculator selfEmploymentTax,
			IncomeAggregator incomes) {
		this.config = config;
		this.selfEmploymentTax = selfEmploymentTax;
		this.incomes = incomes;
	}

	public LiabilityBreakdown calculate(TaxReturn taxReturn, BigDecimal taxableIncome, BigDecimal agi) {
		FilingStatus status = taxReturn.filingStatus();
		BigDecimal longTermGains = taxReturn.longTermCapitalGains();

		// long-term gains stay in the bracket base and are also taxed at the tier rate
		BigDecimal bracketTax = bracketTax(taxableIncome, status);
		BigDecimal seTax = selfEmploymentTax.selfEmploymentTax(taxReturn);
		BigDecimal capitalGainsTax = capitalGainsTax(longTermGains, taxableIncome, status);
		BigDecimal niit = netInvestmentIncomeTax(taxReturn, agi);
		BigDecimal additionalMedicare = additionalMedicareTax(taxReturn);

		BigDecimal total = TaxRounding.round(bracketTax
				.add(seTax)
				.add(capitalGainsTax)
				.add(niit)
				.add(additionalMedicare));
		return new LiabilityBreakdown(TaxRounding.round(taxableIncome), bracketTax, seTax, capitalGainsTax, niit,
				additionalMedicare, total);
	}

	/**
	 * Progressive tax with each bracket's share rounded before it is added.
	 */
	public BigDecimal bracketTax(BigDecimal taxableIncome, FilingStatus status) {
		return TaxRounding.round(bracketBreakdown(taxableIncome, status).stream()
				.map(BracketSlice::taxInBracket)
				.reduce(BigDecimal.ZERO, BigDecimal::add));
	}

	/**
	 * One slice per bracket the income reaches.
	 */
	public List<BracketSlice> bracketBreakdown(BigDecimal taxableIncome, FilingStatus status) {
		List<BracketSlice> slices = new ArrayList<>();
		if (taxableIncome.signum() <= 0)
			return slices;

		BigDecimal previousBound = BigDecimal.ZERO;
		for (TaxBracket bracket : config.bracketsFor(status)) {
			if (taxableIncome.compareTo(previousBound) <= 0)
				break;
			BigDecimal inBracket = bracket.cap(taxableIncome).subtract(previousBound).max(BigDecimal.ZERO);
			slices.add(new BracketSlice(previousBound, bracket.upperBound(), bracket.rate(),
					TaxRounding.round(inBracket.multiply(bracket.rate()))));
			if (bracket.isTerminal())
				break;
			previousBound = bracket.upperBound();
		}
		return slices;
	}

	// rate of the bracket that holds the last dollar of income
	public BigDecimal marginalRate(BigDecimal taxableIncome, FilingStatus status) {
		List<TaxBracket> schedule = config.bracketsFor(status);
		for (TaxBracket bracket : schedule) {
			if (bracket.isTerminal() || taxableIncome.compareTo(bracket.upperBound()) <= 0)
				return bracket.rate();
		}
		return schedule.get(schedule.size() - 1).rate();
	}

	/**
	 * A single rate for all preferential gains, chosen by where total taxable
	 * income falls: 0%, then the middle rate, then the top rate.
	 */
	public BigDecimal capitalGainsTax(BigDecimal gains, BigDecimal taxableIncome, FilingStatus status) {
		SurtaxRules rules = config.surtaxes();
		if (gains.signum() <= 0 || taxableIncome.compareTo(rules.capitalGainsZeroRateMax().get(status)) <= 0)
			return TaxRounding.zero();
		BigDecimal rate = taxableIncome.compareTo(rules.capitalGainsFifteenRateMax().get(status)) <= 0
				? rules.capitalGainsMiddleRate()
				: rules.capitalGainsTopRate();
		return TaxRounding.round(gains.multiply(rate));
	}

	public BigDecimal netInvestmentIncomeTax(TaxReturn taxReturn, BigDecimal agi) {
		SurtaxRules rules = config.surtaxes();
		BigDecimal threshold = rules.netInvestmentIncomeThreshold().get(taxReturn.filingStatus());
		if (agi.compareTo(threshold) <= 0)
			return TaxRounding.zero();

		BigDecimal base = incomes.investmentIncome(taxReturn).min(agi.subtract(threshold));
		return TaxRounding.nonNegative(base.multiply(rules.netInvestmentIncomeRate()));
	}

	/**
	 * Applies to W-2 wages plus self-employment profit above the threshold.
	 */
	public BigDecimal additionalMedicareTax(TaxReturn taxReturn) {
		SurtaxRules rules = config.surtaxes();
		BigDecimal earnings = taxReturn.totalW2Wages().add(taxReturn.totalSelfEmploymentProfit());
		BigDecimal threshold = rules.additionalMedicareThreshold().get(taxReturn.filingStatus());
		if (earnings.compareTo(threshold) <= 0)
			return TaxRounding.zero();
		return TaxRounding.round(earnings.subtract(threshold).multiply(rules.additionalMedicareRate()));
	}
}

package com.example.tax.infrastructure.config;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.example.tax.domain.config.AdjustmentRules;
import com.example.tax.domain.config.CreditRules;
import com.example.tax.domain.config.DeductionRules;
import com.example.tax.domain.config.EarnedIncomeCreditRow;
import com.example.tax.domain.config.SelfEmploymentTaxRules;
import com.example.tax.domain.config.StatusAmounts;
import com.example.tax.domain.config.SurtaxRules;
import com.example.tax.domain.config.TaxBracket;
import com.example.tax.domain.config.TaxYearConfig;
import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.FilingStatus;

/**
 * Maps a tax-year YAML document onto {@link TaxYearConfig}. Amounts are read
 * through their string form so no binary float ever touches a rate.
 */
public class TaxYearConfigYamlReader {

	public TaxYearConfig read(InputStream in, String source) {
		Object document;
		try (in) {
			document = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
		} catch (IOException | YAMLException e) {
			throw new TaxConfigurationException("cannot read rate tables from " + source, e);
		}
		if (!(document instanceof Map<?, ?> root))
			throw new TaxConfigurationException(source + " is not a mapping");
		return toConfig(new Node(source, root));
	}

	private TaxYearConfig toConfig(Node root) {
		int taxYear = root.integer("taxYear");

		Node bracketsNode = root.child("brackets");
		Map<FilingStatus, List<TaxBracket>> brackets = new EnumMap<>(FilingStatus.class);
		for (FilingStatus status : FilingStatus.values()) {
			List<TaxBracket> schedule = new ArrayList<>();
			for (Node row : bracketsNode.list(status.name())) {
				BigDecimal rate = row.amount("rate");
				schedule.add(row.has("upTo") ? new TaxBracket(row.amount("upTo"), rate) : new TaxBracket(null, rate));
			}
			brackets.put(status, schedule);
		}

		Node d = root.child("deductions");
		DeductionRules deductions = new DeductionRules(
				d.byStatus("standard"),
				d.amount("additionalUnmarried"),
				d.amount("additionalMarried"),
				d.amount("seniorDeduction"),
				d.integer("seniorAge"),
				d.amount("medicalAgiFloorRate"),
				d.amount("saltCap"),
				d.amount("autoLoanInterestCap"),
				d.amount("charitableAgiLimitRate"),
				d.amount("qbiRate"),
				d.byStatus("qbiPhaseoutThreshold"));

		Node a = root.child("adjustments");
		AdjustmentRules adjustments = new AdjustmentRules(
				a.amount("educatorExpenseCap"),
				a.amount("studentLoanInterestCap"),
				a.amount("tipsDeductionMax"),
				a.amount("tipsPhaseoutRate"),
				a.byStatus("tipsPhaseoutThreshold"),
				a.amount("overtimeDeductionMax"),
				a.amount("overtimeWageCliff"));

		Node se = root.child("selfEmployment");
		SelfEmploymentTaxRules selfEmployment = new SelfEmploymentTaxRules(
				se.amount("netEarningsFactor"),
				se.amount("socialSecurityRate"),
				se.amount("socialSecurityWageBase"),
				se.amount("medicareRate"),
				se.amount("deductibleShare"));

		Node s = root.child("surtaxes");
		SurtaxRules surtaxes = new SurtaxRules(
				s.byStatus("capitalGainsZeroRateMax"),
				s.byStatus("capitalGainsFifteenRateMax"),
				s.amount("capitalGainsMiddleRate"),
				s.amount("capitalGainsTopRate"),
				s.amount("netInvestmentIncomeRate"),
				s.byStatus("netInvestmentIncomeThreshold"),
				s.amount("additionalMedicareRate"),
				s.byStatus("additionalMedicareThreshold"));

		Node c = root.child("credits");
		CreditRules credits = new CreditRules(
				c.amount("childCreditPerChild"),
				c.amount("childCreditRefundablePerChild"),
				c.byStatus("childCreditPhaseoutThreshold"),
				c.amount("childCreditPhaseoutStep"),
				c.amount("childCreditPhaseoutIncrement"),
				c.amount("otherDependentCredit"),
				c.amount("americanOpportunityRefundableShare"),
				eicRows(c.list("earnedIncomeJoint")),
				eicRows(c.list("earnedIncomeOther")));

		return new TaxYearConfig(taxYear, brackets, deductions, adjustments, selfEmployment, surtaxes, credits);
	}

	private static List<EarnedIncomeCreditRow> eicRows(List<Node> rows) {
		return rows.stream()
				.map(r -> new EarnedIncomeCreditRow(r.amount("maxAgi"), r.amount("maxCredit")))
				.toList();
	}

	/** A YAML mapping plus the path it was found at, for error messages. */
	private record Node(String path, Map<?, ?> values) {

		boolean has(String key) {
			return values.containsKey(key);
		}

		Object required(String key) {
			Object value = values.get(key);
			if (value == null)
				throw new TaxConfigurationException("missing " + path + "." + key);
			return value;
		}

		Node child(String key) {
			Object value = required(key);
			if (!(value instanceof Map<?, ?> map))
				throw new TaxConfigurationException(path + "." + key + " must be a mapping");
			return new Node(path + "." + key, map);
		}

		List<Node> list(String key) {
			Object value = required(key);
			if (!(value instanceof List<?> items))
				throw new TaxConfigurationException(path + "." + key + " must be a list");
			List<Node> nodes = new ArrayList<>();
			for (int i = 0; i < items.size(); i++) {
				if (!(items.get(i) instanceof Map<?, ?> map))
					throw new TaxConfigurationException(path + "." + key + "[" + i + "] must be a mapping");
				nodes.add(new Node(path + "." + key + "[" + i + "]", map));
			}
			return nodes;
		}

		BigDecimal amount(String key) {
			Object value = required(key);
			try {
				return new BigDecimal(value.toString());
			} catch (NumberFormatException e) {
				throw new TaxConfigurationException(path + "." + key + " is not a number: " + value, e);
			}
		}

		int integer(String key) {
			Object value = required(key);
			if (value instanceof Integer i)
				return i;
			try {
				return Integer.parseInt(value.toString());
			} catch (NumberFormatException e) {
				throw new TaxConfigurationException(path + "." + key + " is not an integer: " + value, e);
			}
		}

		StatusAmounts byStatus(String key) {
			Node table = child(key);
			Map<FilingStatus, BigDecimal> amounts = new EnumMap<>(FilingStatus.class);
			for (FilingStatus status : FilingStatus.values()) {
				if (table.has(status.name())) {
					amounts.put(status, table.amount(status.name()));
				}
			}
			return StatusAmounts.of(table.path(), amounts);
		}
	}
}

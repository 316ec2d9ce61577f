package com.example.tax.infrastructure.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.example.tax.domain.error.TaxConfigurationException;

/**
 * Process-level settings read from tax-engine.yaml on the classpath.
 */
public record TaxEngineSettings(List<Integer> supportedTaxYears, int defaultTaxYear) {
	public static final String RESOURCE = "tax-engine.yaml";

	public TaxEngineSettings {
		supportedTaxYears = List.copyOf(supportedTaxYears);
		if (supportedTaxYears.isEmpty())
			throw new TaxConfigurationException("no supported tax years configured");
		if (!supportedTaxYears.contains(defaultTaxYear))
			throw new TaxConfigurationException("default tax year " + defaultTaxYear + " is not supported");
	}

	public static TaxEngineSettings load() {
		return load(RESOURCE);
	}

	public static TaxEngineSettings load(String resource) {
		try (InputStream in = TaxEngineSettings.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null)
				throw new TaxConfigurationException("missing classpath resource " + resource);
			Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
			if (!(document instanceof Map<?, ?> root))
				throw new TaxConfigurationException(resource + " is not a mapping");
			return new TaxEngineSettings(years(root.get("supportedTaxYears"), resource),
					year(root.get("defaultTaxYear"), resource));
		} catch (IOException | YAMLException e) {
			throw new TaxConfigurationException("cannot read " + resource, e);
		}
	}

	private static List<Integer> years(Object value, String resource) {
		if (!(value instanceof List<?> items))
			throw new TaxConfigurationException(resource + ": supportedTaxYears must be a list");
		return items.stream().map(item -> year(item, resource)).toList();
	}

	private static int year(Object value, String resource) {
		if (value instanceof Integer year)
			return year;
		throw new TaxConfigurationException(resource + ": tax year must be an integer, got " + value);
	}
}

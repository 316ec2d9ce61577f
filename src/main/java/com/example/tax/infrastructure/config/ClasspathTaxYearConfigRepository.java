package com.example.tax.infrastructure.config;

import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.tax.domain.config.TaxYearConfig;
import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.port.outbound.TaxYearConfigRepository;

/**
 * Loads tax-years/&lt;year&gt;.yaml for each requested year up front. After
 * construction the repository is read-only and safe to share across threads.
 */
public class ClasspathTaxYearConfigRepository implements TaxYearConfigRepository {
	private static final Logger log = LoggerFactory.getLogger(ClasspathTaxYearConfigRepository.class);
	private static final String RESOURCE_PATTERN = "tax-years/%d.yaml";

	private final Map<Integer, TaxYearConfig> store;
	private final int defaultYear;

	public ClasspathTaxYearConfigRepository(Collection<Integer> taxYears) {
		this(taxYears, Collections.max(taxYears));
	}

	public ClasspathTaxYearConfigRepository(Collection<Integer> taxYears, int defaultYear) {
		if (!taxYears.contains(defaultYear))
			throw new TaxConfigurationException(
					"default tax year " + defaultYear + " is not among supported years " + taxYears);
		TaxYearConfigYamlReader reader = new TaxYearConfigYamlReader();
		Map<Integer, TaxYearConfig> loaded = new TreeMap<>();
		for (int year : taxYears) {
			loaded.put(year, load(reader, year));
		}
		this.store = Collections.unmodifiableMap(loaded);
		this.defaultYear = defaultYear;
		log.info("Loaded rate tables for tax years {} (default {})", store.keySet(), defaultYear);
	}

	public static ClasspathTaxYearConfigRepository fromSettings(TaxEngineSettings settings) {
		return new ClasspathTaxYearConfigRepository(settings.supportedTaxYears(), settings.defaultTaxYear());
	}

	@Override
	public Optional<TaxYearConfig> findByYear(int taxYear) {
		return Optional.ofNullable(store.get(taxYear));
	}

	@Override
	public Set<Integer> supportedYears() {
		return store.keySet();
	}

	@Override
	public int defaultYear() {
		return defaultYear;
	}

	private static TaxYearConfig load(TaxYearConfigYamlReader reader, int year) {
		String resource = String.format(RESOURCE_PATTERN, year);
		InputStream in = ClasspathTaxYearConfigRepository.class.getClassLoader().getResourceAsStream(resource);
		if (in == null)
			throw new TaxConfigurationException("no rate tables for tax year " + year + " (" + resource + ")");
		TaxYearConfig config = reader.read(in, resource);
		if (config.taxYear() != year)
			throw new TaxConfigurationException(resource + " declares tax year " + config.taxYear());
		return config;
	}
}

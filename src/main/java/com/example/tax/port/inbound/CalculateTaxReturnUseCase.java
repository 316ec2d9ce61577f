package com.example.tax.port.inbound;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.tax.app.TaxCalculationService;
import com.example.tax.app.dto.TaxCalculationResult;
import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.model.TaxReturnPersistenceModel;
import com.example.tax.port.outbound.SaveTaxReturnPort;
import com.example.tax.port.outbound.TaxYearConfigRepository;

/**
 * Computes a return with the engine for its tax year and stores the outcome.
 * Nothing is saved when validation or configuration lookup fails.
 */
public class CalculateTaxReturnUseCase {
	private static final Logger log = LoggerFactory.getLogger(CalculateTaxReturnUseCase.class);

	private final TaxYearConfigRepository configs;
	private final SaveTaxReturnPort savePort;
	private final Map<Integer, TaxCalculationService> engines = new ConcurrentHashMap<>();

	public CalculateTaxReturnUseCase(TaxYearConfigRepository configs, SaveTaxReturnPort savePort) {
		this.configs = configs;
		this.savePort = savePort;
	}

	public String execute(TaxReturn taxReturn) {
		if (taxReturn == null)
			throw new InvalidTaxReturnException("tax return must not be null");

		TaxCalculationService engine = engines.computeIfAbsent(taxReturn.taxYear(),
				year -> TaxCalculationService.forYear(configs, year));
		TaxCalculationResult result = engine.calculate(taxReturn);

		TaxReturnPersistenceModel model = new TaxReturnPersistenceModel(
				taxReturn.taxYear(),
				taxReturn.filingStatus(),
				taxReturn.dependents().size(),
				result.grossIncome(),
				result.adjustedGrossIncome(),
				result.deductionKind(),
				result.taxableIncome(),
				result.taxLiability(),
				result.taxAfterCredits(),
				result.totalPayments(),
				result.refundAmount(),
				result.amountOwed(),
				result.appliedAdjustments());
		String id = savePort.save(model);
		log.info("Saved {} return {}", taxReturn.taxYear(), id);
		return id;
	}
}

package com.example.tax.port.outbound;

import com.example.tax.domain.model.TaxReturnPersistenceModel;

public interface SaveTaxReturnPort {
	// returns the id assigned by the store
	String save(TaxReturnPersistenceModel taxReturn);
}

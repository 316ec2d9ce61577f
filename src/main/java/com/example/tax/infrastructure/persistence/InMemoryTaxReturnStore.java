package com.example.tax.infrastructure.persistence;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.example.tax.domain.model.TaxReturnPersistenceModel;
import com.example.tax.port.outbound.SaveTaxReturnPort;

public class InMemoryTaxReturnStore implements SaveTaxReturnPort {
	private final Map<String, TaxReturnPersistenceModel> store = new ConcurrentHashMap<>();

	@Override
	public String save(TaxReturnPersistenceModel taxReturn) {
		if (taxReturn == null)
			throw new IllegalArgumentException("taxReturn must not be null");
		String id = UUID.randomUUID().toString();
		store.put(id, taxReturn);
		return id;
	}

	public Optional<TaxReturnPersistenceModel> findById(String id) {
		return Optional.ofNullable(store.get(id));
	}

	public int size() {
		return store.size();
	}
}

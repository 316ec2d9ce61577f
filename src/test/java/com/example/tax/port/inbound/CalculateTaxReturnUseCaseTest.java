package com.example.tax.port.inbound;

import static com.example.tax.TaxReturnFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.tax.domain.error.InvalidTaxReturnException;
import com.example.tax.domain.error.TaxConfigurationException;
import com.example.tax.domain.model.DeductionKind;
import com.example.tax.domain.model.FilingStatus;
import com.example.tax.domain.model.TaxReturn;
import com.example.tax.domain.model.TaxReturnPersistenceModel;
import com.example.tax.infrastructure.config.ClasspathTaxYearConfigRepository;
import com.example.tax.infrastructure.persistence.InMemoryTaxReturnStore;
import com.example.tax.port.outbound.SaveTaxReturnPort;
import com.example.tax.port.outbound.TaxYearConfigRepository;

@ExtendWith(MockitoExtension.class)
class CalculateTaxReturnUseCaseTest {
	@Mock
	TaxYearConfigRepository configs;
	@Mock
	SaveTaxReturnPort savePort;
	CalculateTaxReturnUseCase app;

	@BeforeEach
	void setUp() {
		app = new CalculateTaxReturnUseCase(configs, savePort);
	}

	@Test
	@Tag("anchor")
	void saves_model_built_from_result() {
		when(configs.findByYear(2025)).thenReturn(Optional.of(config2025()));
		when(savePort.save(any())).thenReturn("RET-001");

		String id = app.execute(taxReturn(FilingStatus.SINGLE, children(1), w2("50000", "6000")));
		assertThat(id).isEqualTo("RET-001");

		var cap = ArgumentCaptor.forClass(TaxReturnPersistenceModel.class);
		verify(savePort).save(cap.capture());
		var m = cap.getValue();
		assertThat(m.taxYear()).isEqualTo(2025);
		assertThat(m.filingStatus()).isEqualTo(FilingStatus.SINGLE);
		assertThat(m.dependentCount()).isEqualTo(1);
		assertThat(m.deductionKind()).isEqualTo(DeductionKind.STANDARD);
		assertThat(m.taxableIncome()).isEqualByComparingTo("35400.00");
		assertThat(m.taxLiability()).isEqualByComparingTo("4016.00");
		// 2200 CTC: 500 nonrefundable, 1700 refundable
		assertThat(m.taxAfterCredits()).isEqualByComparingTo("3516.00");
		assertThat(m.refundAmount()).isEqualByComparingTo("4184.00");

		InOrder io = inOrder(configs, savePort);
		io.verify(configs).findByYear(2025);
		io.verify(savePort).save(any());
		io.verifyNoMoreInteractions();
	}

	@Test
	void engine_is_built_once_per_year() {
		when(configs.findByYear(2025)).thenReturn(Optional.of(config2025()));
		when(savePort.save(any())).thenReturn("A", "B");

		app.execute(single(w2("50000", "0")));
		app.execute(single(w2("60000", "0")));

		verify(configs, times(1)).findByYear(2025);
		verify(savePort, times(2)).save(any());
	}

	@Test
	@DisplayName("nothing is saved for an unsupported tax year")
	void does_not_save_when_year_unsupported() {
		TaxReturn r = new TaxReturn(2019, FilingStatus.SINGLE, bornIn(1985), null, null, List.of(w2("1", "0")), null,
				null, null, null);

		assertThatThrownBy(() -> app.execute(r))
				.isInstanceOf(TaxConfigurationException.class)
				.hasMessageContaining("2019");
		verifyNoInteractions(savePort);
	}

	@Test
	void does_not_save_when_return_invalid() {
		when(configs.findByYear(2025)).thenReturn(Optional.of(config2025()));
		TaxReturn r = single(w2("50000", "-10"));

		assertThatThrownBy(() -> app.execute(r)).isInstanceOf(InvalidTaxReturnException.class);
		verifyNoInteractions(savePort);
	}

	@Test
	void rejects_null_return() {
		assertThatThrownBy(() -> app.execute(null)).isInstanceOf(InvalidTaxReturnException.class);
		verifyNoInteractions(configs, savePort);
	}

	@Test
	void wired_with_classpath_tables_and_in_memory_store() {
		var store = new InMemoryTaxReturnStore();
		var wired = new CalculateTaxReturnUseCase(new ClasspathTaxYearConfigRepository(List.of(2025)), store);

		String id = wired.execute(single(w2("50000", "6000")));

		assertThat(store.findById(id)).hasValueSatisfying(m -> {
			assertThat(m.refundAmount()).isEqualByComparingTo("1984.00");
			assertThat(m.amountOwed()).isEqualByComparingTo("0.00");
		});
	}
}

package my.carbonmodel.app.service;

import my.carbonmodel.app.dto.ModelValidationResponse;
import my.carbonmodel.app.engine.FinancialModelEngine;
import my.carbonmodel.app.engine.ModelResult;
import my.carbonmodel.app.engine.StatementInvariants;
import my.carbonmodel.app.inputs.InputValidationException;
import my.carbonmodel.app.inputs.InputValidator;
import my.carbonmodel.app.inputs.ModelInputs;
import my.carbonmodel.app.inputs.ModelInputsDocument;
import my.carbonmodel.app.support.ModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinancialModelServiceTest {
	@Mock
	private FinancialModelEngine engine;

	@Mock
	private StatementCsvExporter csvExporter;

	private FinancialModelService service;

	@BeforeEach
	void setUp() {
		service = new FinancialModelService(engine, new InputValidator(), new StatementInvariants(), csvExporter);
	}

	@Test
	void computeValidatesBeforeCallingEngine() {
		ModelResult expected = new FinancialModelEngine().compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO));
		when(engine.compute(any(ModelInputs.class))).thenReturn(expected);

		ModelResult result = service.compute(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO));

		assertThat(result).isSameAs(expected);
		ArgumentCaptor<ModelInputs> captor = ArgumentCaptor.forClass(ModelInputs.class);
		verify(engine).compute(captor.capture());
		assertThat(captor.getValue().years()).containsExactly(2025, 2026, 2027);
	}

	@Test
	void computeRejectsInvalidInputsWithoutCallingEngine() {
		String json = ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("debt_draw", List.of(1, 1, 0)));

		assertThatThrownBy(() -> service.compute(json))
				.isInstanceOfSatisfying(InputValidationException.class,
						ex -> assertThat(ex.getErrors()).contains("debt_draw may be non-zero in at most one year"));
		verifyNoInteractions(engine);
	}

	@Test
	void validateCollectsErrors() {
		ModelValidationResponse response = service.validate(
				ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("cogs_rate", 1.2, "purchase_share", 0)));

		assertThat(response.valid()).isFalse();
		assertThat(response.errors()).containsExactly(
				"cogs_rate must be between 0 and 1",
				"purchase_share must be greater than 0 when purchase_amount is set");
		assertThat(response.warnings()).isEmpty();
		verifyNoInteractions(engine);
	}

	@Test
	void validateReportsUnknownKeyAsError() {
		ModelValidationResponse response = service.validate(
				ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("leverage", 2)));

		assertThat(response.valid()).isFalse();
		assertThat(response.errors()).containsExactly("unrecognized key: leverage");
	}

	@Test
	void validateReturnsOpeningBalanceWarning() {
		ModelValidationResponse response = service.validate(
				ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO, Map.of("initial_equity_t0", 5000)));

		assertThat(response.valid()).isTrue();
		assertThat(response.errors()).isEmpty();
		assertThat(response.warnings()).singleElement().asString().contains("balance_check");
	}

	@Test
	void validateChecksDocumentOnce() {
		InputValidator validator = spy(new InputValidator());
		FinancialModelService checked = new FinancialModelService(engine, validator, new StatementInvariants(), csvExporter);

		ModelValidationResponse response = checked.validate(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO));

		assertThat(response.valid()).isTrue();
		verify(validator, times(1)).validate(any(ModelInputsDocument.class));
		verify(validator, never()).normalize(any(ModelInputsDocument.class));
	}

	@Test
	void exportWritesComputedStatement() {
		ModelResult computed = new FinancialModelEngine().compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO));
		when(engine.compute(any(ModelInputs.class))).thenReturn(computed);
		when(csvExporter.export(computed, StatementType.DEBT_SCHEDULE)).thenReturn("year\n2025\n");

		String csv = service.export(ModelFixtures.json(ModelFixtures.THREE_YEAR_SCENARIO), StatementType.DEBT_SCHEDULE);

		assertThat(csv).isEqualTo("year\n2025\n");
		verify(csvExporter).export(eq(computed), eq(StatementType.DEBT_SCHEDULE));
	}
}

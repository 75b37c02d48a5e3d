package my.carbonmodel.app.service;

import my.carbonmodel.app.dto.ModelValidationResponse;
import my.carbonmodel.app.engine.FinancialModelEngine;
import my.carbonmodel.app.engine.InvariantResult;
import my.carbonmodel.app.engine.ModelResult;
import my.carbonmodel.app.engine.StatementInvariants;
import my.carbonmodel.app.inputs.InputValidationException;
import my.carbonmodel.app.inputs.InputValidator;
import my.carbonmodel.app.inputs.ModelInputs;
import my.carbonmodel.app.inputs.ModelInputsDocument;
import my.carbonmodel.app.inputs.ModelInputsParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FinancialModelService {
	private static final Logger logger = LoggerFactory.getLogger(FinancialModelService.class);

	private final FinancialModelEngine engine;
	private final InputValidator validator;
	private final StatementInvariants invariants;
	private final StatementCsvExporter csvExporter;
	private final ModelInputsParser parser;

	public FinancialModelService(FinancialModelEngine engine,
								 InputValidator validator,
								 StatementInvariants invariants,
								 StatementCsvExporter csvExporter) {
		this.engine = engine;
		this.validator = validator;
		this.invariants = invariants;
		this.csvExporter = csvExporter;
		this.parser = new ModelInputsParser();
	}

	public ModelResult compute(String inputsJson) {
		return compute(parseInputs(inputsJson));
	}

	public ModelResult compute(ModelInputs inputs) {
		for (String advisory : validator.advisories(inputs)) {
			logger.warn("Opening balance advisory: {}", advisory);
		}
		ModelResult result = engine.compute(inputs);
		List<InvariantResult> failures = invariants.failures(result);
		for (InvariantResult failure : failures) {
			logger.warn("Statement check {} failed: {}", failure.name(), String.join("; ", failure.details()));
		}
		logger.info("Computed financial model for {} years ({} to {}), {} statement checks failed.",
				inputs.length(), inputs.years().get(0), inputs.years().get(inputs.length() - 1), failures.size());
		return result;
	}

	public ModelValidationResponse validate(String inputsJson) {
		try {
			ModelInputsDocument document = parser.parse(inputsJson);
			List<String> errors = validator.validate(document);
			if (!errors.isEmpty()) {
				return new ModelValidationResponse(false, errors, List.of());
			}
			ModelInputs inputs = validator.toInputs(document);
			return new ModelValidationResponse(true, List.of(), validator.advisories(inputs));
		} catch (InputValidationException ex) {
			return new ModelValidationResponse(false, ex.getErrors(), List.of());
		}
	}

	public String export(String inputsJson, StatementType type) {
		ModelResult result = compute(inputsJson);
		return csvExporter.export(result, type);
	}

	public ModelInputs parseInputs(String inputsJson) {
		ModelInputsDocument document = parser.parse(inputsJson);
		ModelInputs inputs = validator.normalize(document);
		logger.debug("Validated model inputs for years {}.", inputs.years());
		return inputs;
	}
}

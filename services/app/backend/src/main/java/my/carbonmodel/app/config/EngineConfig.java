package my.carbonmodel.app.config;

import my.carbonmodel.app.engine.EngineSettings;
import my.carbonmodel.app.engine.FinancialModelEngine;
import my.carbonmodel.app.engine.StatementInvariants;
import my.carbonmodel.app.inputs.InputValidator;
import my.carbonmodel.app.service.StatementCsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);
	private static final int DEFAULT_DECIMAL_PLACES = 2;

	@Bean
	public EngineSettings engineSettings(AppProperties properties) {
		EngineSettings defaults = EngineSettings.defaults();
		AppProperties.Model model = properties.model();
		if (model == null) {
			logger.info("No app.model settings found, using engine defaults.");
			return defaults;
		}
		AppProperties.Model.Irr irr = model.irr();
		EngineSettings settings = new EngineSettings(
				orDefault(model.schemaVersion(), defaults.schemaVersion()),
				orDefault(model.balanceTolerance(), defaults.balanceTolerance()),
				irr == null ? defaults.irrLowerBound() : orDefault(irr.lowerBound(), defaults.irrLowerBound()),
				irr == null ? defaults.irrUpperBound() : orDefault(irr.upperBound(), defaults.irrUpperBound()),
				irr == null ? defaults.irrTolerance() : orDefault(irr.tolerance(), defaults.irrTolerance()),
				irr == null || irr.maxIterations() == null ? defaults.irrMaxIterations() : irr.maxIterations()
		);
		if (settings.irrLowerBound().compareTo(settings.irrUpperBound()) >= 0) {
			throw new IllegalStateException("app.model.irr.lower-bound must be below app.model.irr.upper-bound");
		}
		if (settings.irrLowerBound().compareTo(BigDecimal.ONE.negate()) <= 0) {
			throw new IllegalStateException("app.model.irr.lower-bound must be greater than -1");
		}
		logger.info("Financial model engine configured (schemaVersion={}, balanceTolerance={}, irrBounds=[{}, {}]).",
				settings.schemaVersion(), settings.balanceTolerance(), settings.irrLowerBound(), settings.irrUpperBound());
		return settings;
	}

	@Bean
	public FinancialModelEngine financialModelEngine(EngineSettings settings) {
		return new FinancialModelEngine(settings);
	}

	@Bean
	public InputValidator inputValidator(EngineSettings settings) {
		return new InputValidator(settings.balanceTolerance());
	}

	@Bean
	public StatementInvariants statementInvariants(EngineSettings settings) {
		return new StatementInvariants(settings.balanceTolerance());
	}

	@Bean
	public StatementCsvExporter statementCsvExporter(AppProperties properties) {
		Integer decimalPlaces = properties.export() == null ? null : properties.export().decimalPlaces();
		return new StatementCsvExporter(decimalPlaces == null ? DEFAULT_DECIMAL_PLACES : decimalPlaces);
	}

	private static <T> T orDefault(T value, T fallback) {
		return value == null ? fallback : value;
	}
}

package my.carbonmodel.app.engine;

import java.math.BigDecimal;

public record EngineSettings(
		String schemaVersion,
		BigDecimal balanceTolerance,
		BigDecimal irrLowerBound,
		BigDecimal irrUpperBound,
		BigDecimal irrTolerance,
		int irrMaxIterations
) {
	public static final String SCHEMA_VERSION = "1.0";

	public static EngineSettings defaults() {
		return new EngineSettings(
				SCHEMA_VERSION,
				new BigDecimal("0.01"),
				new BigDecimal("-0.9999"),
				BigDecimal.TEN,
				new BigDecimal("1e-7"),
				200
		);
	}
}

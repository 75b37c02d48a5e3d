package my.carbonmodel.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Model model,
		@Valid Export export
) {
	public record Model(
			@NotBlank String schemaVersion,
			@PositiveOrZero BigDecimal balanceTolerance,
			@Valid Irr irr
	) {
		public record Irr(
				BigDecimal lowerBound,
				BigDecimal upperBound,
				BigDecimal tolerance,
				@Min(1) Integer maxIterations
		) {
		}
	}

	public record Export(
			@Min(0) Integer decimalPlaces
	) {
	}
}

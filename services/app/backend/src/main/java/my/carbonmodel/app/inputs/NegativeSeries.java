package my.carbonmodel.app.inputs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-year amounts booked as outflows. Every value is zero or negative.
 */
public record NegativeSeries(@JsonValue List<BigDecimal> values) {
	public NegativeSeries {
		if (values == null) {
			throw new IllegalArgumentException("values must be provided");
		}
		for (BigDecimal value : values) {
			if (value == null || value.signum() > 0) {
				throw new IllegalArgumentException("values must be zero or negative: " + value);
			}
		}
		values = List.copyOf(values);
	}

	public int size() {
		return values.size();
	}

	public BigDecimal at(int index) {
		return values.get(index);
	}

	/** Same amount as a positive number, e.g. depreciation added back to cash. */
	public BigDecimal magnitude(int index) {
		return values.get(index).negate();
	}

	public BigDecimal total() {
		BigDecimal total = BigDecimal.ZERO;
		for (BigDecimal value : values) {
			total = total.add(value);
		}
		return total;
	}
}

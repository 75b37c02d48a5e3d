package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.List;

final class Decimals {
	static final MathContext MC = MathContext.DECIMAL128;
	static final BigDecimal ZERO = BigDecimal.ZERO;
	static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

	private Decimals() {
	}

	static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
		return numerator.divide(denominator, MC);
	}

	static BigDecimal sum(List<BigDecimal> values) {
		BigDecimal total = ZERO;
		for (BigDecimal value : values) {
			total = total.add(value);
		}
		return total;
	}

	static BigDecimal max(BigDecimal a, BigDecimal b) {
		return a.compareTo(b) >= 0 ? a : b;
	}

	static BigDecimal min(BigDecimal a, BigDecimal b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	static List<BigDecimal> zeros(int length) {
		return Collections.nCopies(length, ZERO);
	}
}

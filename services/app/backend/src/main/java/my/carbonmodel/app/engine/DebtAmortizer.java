package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-facility schedule on the constant-payment (annuity) method.
 * <p>
 * The facility is drawn once and repaid over {@code durationYears} periods starting in the draw
 * year. Interest expense accrues on the beginning balance, which excludes the current year's draw.
 * The annuity split of each payment uses the balance outstanding after the draw.
 */
public class DebtAmortizer {
	/** Largest term {@link BigDecimal#pow(int, java.math.MathContext)} accepts. */
	public static final int MAX_DURATION_YEARS = 999_999_999;

	public List<DebtPeriod> amortize(List<Integer> years,
									 List<BigDecimal> draws,
									 BigDecimal interestRate,
									 int durationYears) {
		int drawYear = drawYear(draws);
		BigDecimal payment = drawYear < 0
				? Decimals.ZERO
				: constantPayment(draws.get(drawYear), interestRate, durationYears);
		long lastPaymentYear = (long) drawYear + durationYears - 1;

		List<DebtPeriod> periods = new ArrayList<>(years.size());
		BigDecimal balance = Decimals.ZERO;
		for (int t = 0; t < years.size(); t++) {
			BigDecimal beginning = balance;
			BigDecimal draw = draws.get(t);
			BigDecimal outstanding = beginning.add(draw);
			BigDecimal interest = beginning.multiply(interestRate);
			BigDecimal principal = Decimals.ZERO;
			if (drawYear >= 0 && t >= drawYear && t <= lastPaymentYear && outstanding.signum() > 0) {
				if (t == lastPaymentYear) {
					principal = outstanding;
				} else {
					BigDecimal scheduled = payment.subtract(outstanding.multiply(interestRate));
					principal = Decimals.min(Decimals.max(scheduled, Decimals.ZERO), outstanding);
				}
			}
			BigDecimal ending = Decimals.max(outstanding.subtract(principal), Decimals.ZERO);
			periods.add(new DebtPeriod(years.get(t), beginning, draw, principal.negate(), ending, interest));
			balance = ending;
		}
		return List.copyOf(periods);
	}

	/**
	 * Level payment that retires {@code principal} over {@code periods} years at {@code rate}.
	 */
	public static BigDecimal constantPayment(BigDecimal principal, BigDecimal rate, int periods) {
		if (principal.signum() == 0) {
			return Decimals.ZERO;
		}
		if (periods <= 0 || periods > MAX_DURATION_YEARS) {
			throw new IllegalArgumentException("Debt duration must be between 1 and " + MAX_DURATION_YEARS + " years: " + periods);
		}
		if (rate.signum() == 0) {
			return Decimals.divide(principal, BigDecimal.valueOf(periods));
		}
		BigDecimal growth = BigDecimal.ONE.add(rate).pow(periods, Decimals.MC);
		return Decimals.divide(principal.multiply(rate).multiply(growth), growth.subtract(BigDecimal.ONE, Decimals.MC));
	}

	private static int drawYear(List<BigDecimal> draws) {
		for (int t = 0; t < draws.size(); t++) {
			if (draws.get(t).signum() > 0) {
				return t;
			}
		}
		return -1;
	}
}

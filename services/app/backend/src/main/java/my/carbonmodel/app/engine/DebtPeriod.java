package my.carbonmodel.app.engine;

import java.math.BigDecimal;

/**
 * One year of the amortization schedule before EBITDA is known.
 */
public record DebtPeriod(
		int year,
		BigDecimal beginningBalance,
		BigDecimal draw,
		BigDecimal principalPayment,
		BigDecimal endingBalance,
		BigDecimal interestExpense
) {
	public BigDecimal debtService() {
		return principalPayment.abs().add(interestExpense);
	}
}

package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record DebtScheduleRow(
		@JsonProperty("year") int year,
		@JsonProperty("beginning_balance") BigDecimal beginningBalance,
		@JsonProperty("draw") BigDecimal draw,
		@JsonProperty("principal_payment") BigDecimal principalPayment,
		@JsonProperty("ending_balance") BigDecimal endingBalance,
		@JsonProperty("interest_expense") BigDecimal interestExpense,
		@JsonProperty("dscr") BigDecimal dscr
) {
	static DebtScheduleRow of(DebtPeriod period, BigDecimal ebitda) {
		BigDecimal debtService = period.debtService();
		BigDecimal dscr = debtService.signum() > 0 ? Decimals.divide(ebitda, debtService) : Decimals.ZERO;
		return new DebtScheduleRow(
				period.year(),
				period.beginningBalance(),
				period.draw(),
				period.principalPayment(),
				period.endingBalance(),
				period.interestExpense(),
				dscr
		);
	}
}

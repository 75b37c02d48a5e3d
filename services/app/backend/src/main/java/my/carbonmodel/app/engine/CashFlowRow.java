package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record CashFlowRow(
		@JsonProperty("year") int year,
		@JsonProperty("net_income") BigDecimal netIncome,
		@JsonProperty("depreciation_addback") BigDecimal depreciationAddback,
		@JsonProperty("change_accounts_receivable") BigDecimal changeAccountsReceivable,
		@JsonProperty("change_accounts_payable") BigDecimal changeAccountsPayable,
		@JsonProperty("change_unearned_revenue") BigDecimal changeUnearnedRevenue,
		@JsonProperty("interest_addback") BigDecimal interestAddback,
		@JsonProperty("operating_cash_flow") BigDecimal operatingCashFlow,
		@JsonProperty("capex") BigDecimal capex,
		@JsonProperty("investing_cash_flow") BigDecimal investingCashFlow,
		@JsonProperty("debt_draw") BigDecimal debtDraw,
		@JsonProperty("debt_repayment") BigDecimal debtRepayment,
		@JsonProperty("interest_paid") BigDecimal interestPaid,
		@JsonProperty("equity_injection") BigDecimal equityInjection,
		@JsonProperty("financing_cash_flow") BigDecimal financingCashFlow,
		@JsonProperty("cash_start") BigDecimal cashStart,
		@JsonProperty("net_change_cash") BigDecimal netChangeCash,
		@JsonProperty("cash_end") BigDecimal cashEnd
) {
}

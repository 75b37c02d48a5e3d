package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Income statement for one year. Cost lines, depreciation and interest are negative.
 */
public record IncomeStatementRow(
		@JsonProperty("year") int year,
		@JsonProperty("credits_generated") BigDecimal creditsGenerated,
		@JsonProperty("credits_issued") BigDecimal creditsIssued,
		@JsonProperty("spot_revenue") BigDecimal spotRevenue,
		@JsonProperty("pre_purchase_revenue") BigDecimal prePurchaseRevenue,
		@JsonProperty("total_revenue") BigDecimal totalRevenue,
		@JsonProperty("cogs") BigDecimal cogs,
		@JsonProperty("gross_profit") BigDecimal grossProfit,
		@JsonProperty("feasibility_costs") BigDecimal feasibilityCosts,
		@JsonProperty("pdd_costs") BigDecimal pddCosts,
		@JsonProperty("mrv_costs") BigDecimal mrvCosts,
		@JsonProperty("staff_costs") BigDecimal staffCosts,
		@JsonProperty("opex_total") BigDecimal opexTotal,
		@JsonProperty("ebitda") BigDecimal ebitda,
		@JsonProperty("depreciation") BigDecimal depreciation,
		@JsonProperty("interest_expense") BigDecimal interestExpense,
		@JsonProperty("earnings_before_tax") BigDecimal earningsBeforeTax,
		@JsonProperty("income_tax") BigDecimal incomeTax,
		@JsonProperty("net_income") BigDecimal netIncome
) {
}

package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Scalar summary of a model run. Margins are percentages of total revenue. IRR and payback fields
 * are {@code null} when the cash flows have no IRR or never pay back.
 */
public record FinancialMetrics(
		@JsonProperty("total_revenue") BigDecimal totalRevenue,
		@JsonProperty("total_ebitda") BigDecimal totalEbitda,
		@JsonProperty("total_net_income") BigDecimal totalNetIncome,
		@JsonProperty("ebitda_margin") BigDecimal ebitdaMargin,
		@JsonProperty("net_margin") BigDecimal netMargin,
		@JsonProperty("total_credits_issued") BigDecimal totalCreditsIssued,
		@JsonProperty("total_purchased_credits") BigDecimal totalPurchasedCredits,
		@JsonProperty("total_capex") BigDecimal totalCapex,
		@JsonProperty("peak_funding_required") BigDecimal peakFundingRequired,
		@JsonProperty("ending_cash") BigDecimal endingCash,
		@JsonProperty("dscr_minimum") BigDecimal dscrMinimum,
		@JsonProperty("equity_npv") BigDecimal equityNpv,
		@JsonProperty("equity_irr") BigDecimal equityIrr,
		@JsonProperty("investor_irr") BigDecimal investorIrr,
		@JsonProperty("payback_period") BigDecimal paybackPeriod
) {
}

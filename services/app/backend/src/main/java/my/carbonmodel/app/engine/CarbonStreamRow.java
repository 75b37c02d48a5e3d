package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record CarbonStreamRow(
		@JsonProperty("year") int year,
		@JsonProperty("purchase_share") BigDecimal purchaseShare,
		@JsonProperty("credits_issued") BigDecimal creditsIssued,
		@JsonProperty("purchase_amount") BigDecimal purchaseAmount,
		@JsonProperty("purchased_credits") BigDecimal purchasedCredits,
		@JsonProperty("implied_purchase_price") BigDecimal impliedPurchasePrice,
		@JsonProperty("investor_cash_flow") BigDecimal investorCashFlow
) {
}

package my.carbonmodel.app.inputs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Model inputs exactly as submitted. Nothing here is trusted yet; see {@link InputValidator}.
 */
public record ModelInputsDocument(
		@JsonProperty("years") List<BigDecimal> years,
		@JsonProperty("credits_generated") List<BigDecimal> creditsGenerated,
		@JsonProperty("price_per_credit") List<BigDecimal> pricePerCredit,
		@JsonProperty("issuance_flag") List<BigDecimal> issuanceFlag,
		@JsonProperty("cogs_rate") BigDecimal cogsRate,
		@JsonProperty("feasibility_costs") List<BigDecimal> feasibilityCosts,
		@JsonProperty("pdd_costs") List<BigDecimal> pddCosts,
		@JsonProperty("mrv_costs") List<BigDecimal> mrvCosts,
		@JsonProperty("staff_costs") List<BigDecimal> staffCosts,
		@JsonProperty("depreciation") List<BigDecimal> depreciation,
		@JsonProperty("income_tax_rate") BigDecimal incomeTaxRate,
		@JsonProperty("ar_rate") BigDecimal arRate,
		@JsonProperty("ap_rate") BigDecimal apRate,
		@JsonProperty("capex") List<BigDecimal> capex,
		@JsonProperty("equity_injection") List<BigDecimal> equityInjection,
		@JsonProperty("interest_rate") BigDecimal interestRate,
		@JsonProperty("debt_duration_years") BigDecimal debtDurationYears,
		@JsonProperty("debt_draw") List<BigDecimal> debtDraw,
		@JsonProperty("purchase_amount") List<BigDecimal> purchaseAmount,
		@JsonProperty("purchase_share") BigDecimal purchaseShare,
		@JsonProperty("discount_rate") BigDecimal discountRate,
		@JsonProperty("initial_equity_t0") BigDecimal initialEquityT0,
		@JsonProperty("opening_cash_y1") BigDecimal openingCashY1,
		@JsonProperty("initial_ppe") BigDecimal initialPpe
) {
}

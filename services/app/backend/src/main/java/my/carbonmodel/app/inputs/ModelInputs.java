package my.carbonmodel.app.inputs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Validated, canonical model inputs. Every per-year list has one entry per year, cost lines are
 * wrapped in {@link NegativeSeries} and optional scalars are defaulted to zero.
 */
public record ModelInputs(
		@JsonProperty("years") List<Integer> years,
		@JsonProperty("credits_generated") List<BigDecimal> creditsGenerated,
		@JsonProperty("price_per_credit") List<BigDecimal> pricePerCredit,
		@JsonProperty("issuance_flag") List<Integer> issuanceFlag,
		@JsonProperty("cogs_rate") BigDecimal cogsRate,
		@JsonProperty("feasibility_costs") NegativeSeries feasibilityCosts,
		@JsonProperty("pdd_costs") NegativeSeries pddCosts,
		@JsonProperty("mrv_costs") NegativeSeries mrvCosts,
		@JsonProperty("staff_costs") NegativeSeries staffCosts,
		@JsonProperty("depreciation") NegativeSeries depreciation,
		@JsonProperty("income_tax_rate") BigDecimal incomeTaxRate,
		@JsonProperty("ar_rate") BigDecimal arRate,
		@JsonProperty("ap_rate") BigDecimal apRate,
		@JsonProperty("capex") NegativeSeries capex,
		@JsonProperty("equity_injection") List<BigDecimal> equityInjection,
		@JsonProperty("interest_rate") BigDecimal interestRate,
		@JsonProperty("debt_duration_years") int debtDurationYears,
		@JsonProperty("debt_draw") List<BigDecimal> debtDraw,
		@JsonProperty("purchase_amount") List<BigDecimal> purchaseAmount,
		@JsonProperty("purchase_share") BigDecimal purchaseShare,
		@JsonProperty("discount_rate") BigDecimal discountRate,
		@JsonProperty("initial_equity_t0") BigDecimal initialEquityT0,
		@JsonProperty("opening_cash_y1") BigDecimal openingCashY1,
		@JsonProperty("initial_ppe") BigDecimal initialPpe
) {
	public ModelInputs {
		years = List.copyOf(years);
		creditsGenerated = List.copyOf(creditsGenerated);
		pricePerCredit = List.copyOf(pricePerCredit);
		issuanceFlag = List.copyOf(issuanceFlag);
		equityInjection = List.copyOf(equityInjection);
		debtDraw = List.copyOf(debtDraw);
		purchaseAmount = List.copyOf(purchaseAmount);
	}

	@JsonIgnore
	public int length() {
		return years.size();
	}

	/** Opex lines summed for one year; stays zero or negative. */
	public BigDecimal opexTotal(int index) {
		return feasibilityCosts.at(index)
				.add(pddCosts.at(index))
				.add(mrvCosts.at(index))
				.add(staffCosts.at(index));
	}
}

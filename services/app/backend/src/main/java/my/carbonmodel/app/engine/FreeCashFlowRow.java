package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record FreeCashFlowRow(
		@JsonProperty("year") int year,
		@JsonProperty("net_income") BigDecimal netIncome,
		@JsonProperty("depreciation_addback") BigDecimal depreciationAddback,
		@JsonProperty("change_working_capital") BigDecimal changeWorkingCapital,
		@JsonProperty("capex") BigDecimal capex,
		@JsonProperty("net_borrowing") BigDecimal netBorrowing,
		@JsonProperty("fcf_to_equity") BigDecimal fcfToEquity
) {
}

package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.carbonmodel.app.inputs.ModelInputs;

import java.util.List;

public record ModelResult(
		@JsonProperty("schema_version") String schemaVersion,
		@JsonProperty("inputs") ModelInputs inputs,
		@JsonProperty("incomeStatements") List<IncomeStatementRow> incomeStatements,
		@JsonProperty("balanceSheets") List<BalanceSheetRow> balanceSheets,
		@JsonProperty("cashFlowStatements") List<CashFlowRow> cashFlowStatements,
		@JsonProperty("debtSchedule") List<DebtScheduleRow> debtSchedule,
		@JsonProperty("carbonStream") List<CarbonStreamRow> carbonStream,
		@JsonProperty("freeCashFlow") List<FreeCashFlowRow> freeCashFlow,
		@JsonProperty("metrics") FinancialMetrics metrics
) {
	public ModelResult {
		incomeStatements = List.copyOf(incomeStatements);
		balanceSheets = List.copyOf(balanceSheets);
		cashFlowStatements = List.copyOf(cashFlowStatements);
		debtSchedule = List.copyOf(debtSchedule);
		carbonStream = List.copyOf(carbonStream);
		freeCashFlow = List.copyOf(freeCashFlow);
	}
}

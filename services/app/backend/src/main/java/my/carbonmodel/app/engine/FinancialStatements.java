package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Output of one {@link StatementBuilder#build()} run, together with the shared credit flows the
 * statements were built from.
 */
public record FinancialStatements(
		List<BigDecimal> issuedCredits,
		RevenueAllocation allocation,
		List<IncomeStatementRow> incomeStatements,
		List<BalanceSheetRow> balanceSheets,
		List<CashFlowRow> cashFlowStatements,
		List<DebtScheduleRow> debtSchedule
) {
	public FinancialStatements {
		issuedCredits = List.copyOf(issuedCredits);
		incomeStatements = List.copyOf(incomeStatements);
		balanceSheets = List.copyOf(balanceSheets);
		cashFlowStatements = List.copyOf(cashFlowStatements);
		debtSchedule = List.copyOf(debtSchedule);
	}
}

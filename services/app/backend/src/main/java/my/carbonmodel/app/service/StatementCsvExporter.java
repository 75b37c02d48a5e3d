package my.carbonmodel.app.service;

import my.carbonmodel.app.engine.BalanceSheetRow;
import my.carbonmodel.app.engine.CarbonStreamRow;
import my.carbonmodel.app.engine.CashFlowRow;
import my.carbonmodel.app.engine.DebtScheduleRow;
import my.carbonmodel.app.engine.FreeCashFlowRow;
import my.carbonmodel.app.engine.IncomeStatementRow;
import my.carbonmodel.app.engine.ModelResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.Function;

/**
 * Writes one statement of a {@link ModelResult} as CSV, one row per year. Money values are
 * rounded half-up to a fixed number of decimal places.
 */
public class StatementCsvExporter {
	private static final List<Column<IncomeStatementRow>> INCOME_COLUMNS = List.of(
			new Column<>("year", IncomeStatementRow::year),
			new Column<>("credits_generated", IncomeStatementRow::creditsGenerated),
			new Column<>("credits_issued", IncomeStatementRow::creditsIssued),
			new Column<>("spot_revenue", IncomeStatementRow::spotRevenue),
			new Column<>("pre_purchase_revenue", IncomeStatementRow::prePurchaseRevenue),
			new Column<>("total_revenue", IncomeStatementRow::totalRevenue),
			new Column<>("cogs", IncomeStatementRow::cogs),
			new Column<>("gross_profit", IncomeStatementRow::grossProfit),
			new Column<>("feasibility_costs", IncomeStatementRow::feasibilityCosts),
			new Column<>("pdd_costs", IncomeStatementRow::pddCosts),
			new Column<>("mrv_costs", IncomeStatementRow::mrvCosts),
			new Column<>("staff_costs", IncomeStatementRow::staffCosts),
			new Column<>("opex_total", IncomeStatementRow::opexTotal),
			new Column<>("ebitda", IncomeStatementRow::ebitda),
			new Column<>("depreciation", IncomeStatementRow::depreciation),
			new Column<>("interest_expense", IncomeStatementRow::interestExpense),
			new Column<>("earnings_before_tax", IncomeStatementRow::earningsBeforeTax),
			new Column<>("income_tax", IncomeStatementRow::incomeTax),
			new Column<>("net_income", IncomeStatementRow::netIncome)
	);

	private static final List<Column<BalanceSheetRow>> BALANCE_COLUMNS = List.of(
			new Column<>("year", BalanceSheetRow::getYear),
			new Column<>("cash", BalanceSheetRow::getCash),
			new Column<>("accounts_receivable", BalanceSheetRow::getAccountsReceivable),
			new Column<>("ppe_gross", BalanceSheetRow::getPpeGross),
			new Column<>("accumulated_depreciation", BalanceSheetRow::getAccumulatedDepreciation),
			new Column<>("ppe_net", BalanceSheetRow::getPpeNet),
			new Column<>("total_assets", BalanceSheetRow::getTotalAssets),
			new Column<>("accounts_payable", BalanceSheetRow::getAccountsPayable),
			new Column<>("unearned_revenue", BalanceSheetRow::getUnearnedRevenue),
			new Column<>("debt_balance", BalanceSheetRow::getDebtBalance),
			new Column<>("total_liabilities", BalanceSheetRow::getTotalLiabilities),
			new Column<>("contributed_capital", BalanceSheetRow::getContributedCapital),
			new Column<>("retained_earnings", BalanceSheetRow::getRetainedEarnings),
			new Column<>("total_equity", BalanceSheetRow::getTotalEquity),
			new Column<>("total_liabilities_equity", BalanceSheetRow::getTotalLiabilitiesEquity),
			new Column<>("balance_check", BalanceSheetRow::getBalanceCheck)
	);

	private static final List<Column<CashFlowRow>> CASH_FLOW_COLUMNS = List.of(
			new Column<>("year", CashFlowRow::year),
			new Column<>("net_income", CashFlowRow::netIncome),
			new Column<>("depreciation_addback", CashFlowRow::depreciationAddback),
			new Column<>("change_accounts_receivable", CashFlowRow::changeAccountsReceivable),
			new Column<>("change_accounts_payable", CashFlowRow::changeAccountsPayable),
			new Column<>("change_unearned_revenue", CashFlowRow::changeUnearnedRevenue),
			new Column<>("interest_addback", CashFlowRow::interestAddback),
			new Column<>("operating_cash_flow", CashFlowRow::operatingCashFlow),
			new Column<>("capex", CashFlowRow::capex),
			new Column<>("investing_cash_flow", CashFlowRow::investingCashFlow),
			new Column<>("debt_draw", CashFlowRow::debtDraw),
			new Column<>("debt_repayment", CashFlowRow::debtRepayment),
			new Column<>("interest_paid", CashFlowRow::interestPaid),
			new Column<>("equity_injection", CashFlowRow::equityInjection),
			new Column<>("financing_cash_flow", CashFlowRow::financingCashFlow),
			new Column<>("cash_start", CashFlowRow::cashStart),
			new Column<>("net_change_cash", CashFlowRow::netChangeCash),
			new Column<>("cash_end", CashFlowRow::cashEnd)
	);

	private static final List<Column<DebtScheduleRow>> DEBT_COLUMNS = List.of(
			new Column<>("year", DebtScheduleRow::year),
			new Column<>("beginning_balance", DebtScheduleRow::beginningBalance),
			new Column<>("draw", DebtScheduleRow::draw),
			new Column<>("principal_payment", DebtScheduleRow::principalPayment),
			new Column<>("ending_balance", DebtScheduleRow::endingBalance),
			new Column<>("interest_expense", DebtScheduleRow::interestExpense),
			new Column<>("dscr", DebtScheduleRow::dscr)
	);

	private static final List<Column<CarbonStreamRow>> CARBON_STREAM_COLUMNS = List.of(
			new Column<>("year", CarbonStreamRow::year),
			new Column<>("purchase_share", CarbonStreamRow::purchaseShare),
			new Column<>("credits_issued", CarbonStreamRow::creditsIssued),
			new Column<>("purchase_amount", CarbonStreamRow::purchaseAmount),
			new Column<>("purchased_credits", CarbonStreamRow::purchasedCredits),
			new Column<>("implied_purchase_price", CarbonStreamRow::impliedPurchasePrice),
			new Column<>("investor_cash_flow", CarbonStreamRow::investorCashFlow)
	);

	private static final List<Column<FreeCashFlowRow>> FREE_CASH_FLOW_COLUMNS = List.of(
			new Column<>("year", FreeCashFlowRow::year),
			new Column<>("net_income", FreeCashFlowRow::netIncome),
			new Column<>("depreciation_addback", FreeCashFlowRow::depreciationAddback),
			new Column<>("change_working_capital", FreeCashFlowRow::changeWorkingCapital),
			new Column<>("capex", FreeCashFlowRow::capex),
			new Column<>("net_borrowing", FreeCashFlowRow::netBorrowing),
			new Column<>("fcf_to_equity", FreeCashFlowRow::fcfToEquity)
	);

	private final int decimalPlaces;

	public StatementCsvExporter(int decimalPlaces) {
		if (decimalPlaces < 0) {
			throw new IllegalArgumentException("decimalPlaces must not be negative");
		}
		this.decimalPlaces = decimalPlaces;
	}

	public String export(ModelResult result, StatementType type) {
		return switch (type) {
			case INCOME_STATEMENT -> write(INCOME_COLUMNS, result.incomeStatements());
			case BALANCE_SHEET -> write(BALANCE_COLUMNS, result.balanceSheets());
			case CASH_FLOW -> write(CASH_FLOW_COLUMNS, result.cashFlowStatements());
			case DEBT_SCHEDULE -> write(DEBT_COLUMNS, result.debtSchedule());
			case CARBON_STREAM -> write(CARBON_STREAM_COLUMNS, result.carbonStream());
			case FREE_CASH_FLOW -> write(FREE_CASH_FLOW_COLUMNS, result.freeCashFlow());
		};
	}

	private <T> String write(List<Column<T>> columns, List<T> rows) {
		String[] header = columns.stream().map(Column::header).toArray(String[]::new);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(header)
				.setRecordSeparator("\n")
				.build();
		StringWriter out = new StringWriter();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			for (T row : rows) {
				for (Column<T> column : columns) {
					printer.print(format(column.value().apply(row)));
				}
				printer.println();
			}
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to write CSV export", ex);
		}
		return out.toString();
	}

	private String format(Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.setScale(decimalPlaces, RoundingMode.HALF_UP).toPlainString();
		}
		return value.toString();
	}

	private record Column<T>(String header, Function<T, Object> value) {
	}
}

package my.carbonmodel.app.engine;

import my.carbonmodel.app.inputs.ModelInputs;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the calculation pipeline. Holds no state between calls; every {@link #compute}
 * builds its own statements from the validated inputs.
 */
public class FinancialModelEngine {
	private final EngineSettings settings;
	private final CreditIssuanceCalculator issuanceCalculator;
	private final RevenueAllocator revenueAllocator;
	private final DebtAmortizer debtAmortizer;
	private final ReturnsCalculator returnsCalculator;

	public FinancialModelEngine() {
		this(EngineSettings.defaults());
	}

	public FinancialModelEngine(EngineSettings settings) {
		this.settings = settings;
		this.issuanceCalculator = new CreditIssuanceCalculator();
		this.revenueAllocator = new RevenueAllocator();
		this.debtAmortizer = new DebtAmortizer();
		this.returnsCalculator = new ReturnsCalculator(settings);
	}

	public ModelResult compute(ModelInputs inputs) {
		FinancialStatements statements = new StatementBuilder(inputs, issuanceCalculator, revenueAllocator, debtAmortizer)
				.build();
		List<CarbonStreamRow> carbonStream = buildCarbonStream(inputs, statements);
		List<FreeCashFlowRow> freeCashFlow = returnsCalculator.freeCashFlow(inputs, statements);
		FinancialMetrics metrics = buildMetrics(inputs, statements, carbonStream, freeCashFlow);
		return new ModelResult(
				settings.schemaVersion(),
				inputs,
				statements.incomeStatements(),
				statements.balanceSheets(),
				statements.cashFlowStatements(),
				statements.debtSchedule(),
				carbonStream,
				freeCashFlow,
				metrics
		);
	}

	private List<CarbonStreamRow> buildCarbonStream(ModelInputs inputs, FinancialStatements statements) {
		RevenueAllocation allocation = statements.allocation();
		List<CarbonStreamRow> rows = new ArrayList<>(inputs.length());
		for (int t = 0; t < inputs.length(); t++) {
			BigDecimal purchaseAmount = inputs.purchaseAmount().get(t);
			BigDecimal delivered = allocation.delivered().get(t);
			BigDecimal investorCashFlow = purchaseAmount.negate()
					.add(delivered.multiply(inputs.pricePerCredit().get(t)));
			rows.add(new CarbonStreamRow(
					inputs.years().get(t),
					inputs.purchaseShare(),
					statements.issuedCredits().get(t),
					purchaseAmount,
					delivered,
					allocation.impliedPurchasePrice(),
					investorCashFlow
			));
		}
		return rows;
	}

	private FinancialMetrics buildMetrics(ModelInputs inputs,
										  FinancialStatements statements,
										  List<CarbonStreamRow> carbonStream,
										  List<FreeCashFlowRow> freeCashFlow) {
		BigDecimal totalRevenue = Decimals.ZERO;
		BigDecimal totalEbitda = Decimals.ZERO;
		BigDecimal totalNetIncome = Decimals.ZERO;
		for (IncomeStatementRow row : statements.incomeStatements()) {
			totalRevenue = totalRevenue.add(row.totalRevenue());
			totalEbitda = totalEbitda.add(row.ebitda());
			totalNetIncome = totalNetIncome.add(row.netIncome());
		}

		BigDecimal lowestCash = null;
		for (CashFlowRow row : statements.cashFlowStatements()) {
			lowestCash = lowestCash == null ? row.cashEnd() : Decimals.min(lowestCash, row.cashEnd());
		}
		List<CashFlowRow> cashFlows = statements.cashFlowStatements();
		BigDecimal endingCash = cashFlows.get(cashFlows.size() - 1).cashEnd();

		BigDecimal dscrMinimum = null;
		for (DebtScheduleRow row : statements.debtSchedule()) {
			if (row.principalPayment().abs().add(row.interestExpense()).signum() > 0) {
				dscrMinimum = dscrMinimum == null ? row.dscr() : Decimals.min(dscrMinimum, row.dscr());
			}
		}

		List<BigDecimal> equityFlows = returnsCalculator.equityCashFlows(inputs, freeCashFlow);
		List<BigDecimal> investorFlows = carbonStream.stream().map(CarbonStreamRow::investorCashFlow).toList();
		Optional<BigDecimal> investorIrr = statements.allocation().hasPrePurchase()
				? returnsCalculator.irr(investorFlows)
				: Optional.empty();

		return new FinancialMetrics(
				totalRevenue,
				totalEbitda,
				totalNetIncome,
				percentOf(totalEbitda, totalRevenue),
				percentOf(totalNetIncome, totalRevenue),
				Decimals.sum(statements.issuedCredits()),
				Decimals.sum(statements.allocation().delivered()),
				inputs.capex().total().negate(),
				Decimals.max(lowestCash.negate(), Decimals.ZERO),
				endingCash,
				dscrMinimum == null ? Decimals.ZERO : dscrMinimum,
				returnsCalculator.npv(equityFlows, inputs.discountRate()),
				returnsCalculator.irr(equityFlows).orElse(null),
				investorIrr.orElse(null),
				returnsCalculator.payback(equityFlows).orElse(null)
		);
	}

	private static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
		if (whole.signum() <= 0) {
			return Decimals.ZERO;
		}
		return Decimals.divide(part, whole).multiply(Decimals.ONE_HUNDRED);
	}
}

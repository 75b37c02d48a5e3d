package my.carbonmodel.app.engine;

import my.carbonmodel.app.inputs.ModelInputs;
import my.carbonmodel.app.support.ModelFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FinancialModelEngineTest {
	private static final BigDecimal CENT = new BigDecimal("0.01");

	private final FinancialModelEngine engine = new FinancialModelEngine();
	private final StatementInvariants invariants = new StatementInvariants();
	private ModelResult result;

	@BeforeEach
	void setUp() {
		result = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO));
	}

	@Test
	void threeYearScenarioIncomeStatement() {
		IncomeStatementRow year2 = result.incomeStatements().get(1);

		assertThat(year2.creditsIssued()).isEqualByComparingTo("1000");
		assertThat(year2.spotRevenue()).isEqualByComparingTo("8000");
		assertThat(year2.prePurchaseRevenue()).isEqualByComparingTo("2000");
		assertThat(year2.totalRevenue()).isEqualByComparingTo("10000");
		assertThat(year2.cogs()).isEqualByComparingTo("1000");
		assertThat(year2.ebitda()).isEqualByComparingTo("-2000");
		assertThat(year2.interestExpense()).isCloseTo(new BigDecimal("-523.81"), within(CENT));
		assertThat(year2.earningsBeforeTax()).isCloseTo(new BigDecimal("-5523.81"), within(CENT));
		assertThat(year2.incomeTax()).isZero();

		assertThat(result.incomeStatements()).extracting(IncomeStatementRow::ebitda)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("-17000"), new BigDecimal("-2000"), new BigDecimal("-10000"));
	}

	@Test
	void threeYearScenarioCarbonStream() {
		CarbonStreamRow year2 = result.carbonStream().get(1);

		assertThat(year2.purchasedCredits()).isEqualByComparingTo("200");
		assertThat(year2.impliedPurchasePrice()).isEqualByComparingTo("10");
		assertThat(year2.investorCashFlow()).isZero();
		assertThat(result.carbonStream()).extracting(CarbonStreamRow::impliedPurchasePrice)
				.allSatisfy(price -> assertThat(price).isEqualByComparingTo("10"));
	}

	@Test
	void threeYearScenarioDebtSchedule() {
		List<DebtScheduleRow> debt = result.debtSchedule();

		assertThat(debt.get(0).principalPayment()).isCloseTo(new BigDecimal("-4761.90"), within(CENT));
		assertThat(debt.get(1).principalPayment()).isCloseTo(new BigDecimal("-5238.10"), within(CENT));
		assertThat(debt.get(1).endingBalance()).isZero();
		assertThat(debt.get(1).dscr()).isCloseTo(new BigDecimal("-0.347107"), within(new BigDecimal("0.000001")));
		assertThat(debt.get(2).dscr()).isZero();
	}

	@Test
	void threeYearScenarioBalanceSheetAndCash() {
		assertThat(result.balanceSheets()).extracting(BalanceSheetRow::getAccountsPayable)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("1700"), new BigDecimal("1100"), new BigDecimal("1000"));
		assertThat(result.balanceSheets()).extracting(BalanceSheetRow::getPpeNet)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("17000"), new BigDecimal("14000"), new BigDecimal("11000"));
		assertThat(result.balanceSheets()).allSatisfy(row -> {
			assertThat(row.isSettled()).isTrue();
			assertThat(row.getBalanceCheck().abs()).isLessThan(CENT);
		});

		List<CashFlowRow> cashFlows = result.cashFlowStatements();
		assertThat(cashFlows.get(0).operatingCashFlow()).isCloseTo(new BigDecimal("-15300"), within(CENT));
		assertThat(cashFlows.get(0).financingCashFlow()).isCloseTo(new BigDecimal("5238.10"), within(CENT));
		assertThat(cashFlows.get(1).operatingCashFlow()).isCloseTo(new BigDecimal("-3100"), within(CENT));
		assertThat(cashFlows.get(1).financingCashFlow()).isCloseTo(new BigDecimal("-5761.90"), within(CENT));
		assertThat(cashFlows.get(2).cashEnd()).isCloseTo(new BigDecimal("-48523.81"), within(CENT));
	}

	@Test
	void threeYearScenarioFreeCashFlowAndMetrics() {
		assertThat(result.freeCashFlow()).extracting(FreeCashFlowRow::fcfToEquity)
				.satisfiesExactly(
						v -> assertThat(v).isCloseTo(new BigDecimal("-30061.90"), within(CENT)),
						v -> assertThat(v).isCloseTo(new BigDecimal("-8861.90"), within(CENT)),
						v -> assertThat(v).isCloseTo(new BigDecimal("-9600"), within(CENT)));

		FinancialMetrics metrics = result.metrics();
		assertThat(metrics.totalRevenue()).isEqualByComparingTo("10000");
		assertThat(metrics.totalEbitda()).isEqualByComparingTo("-29000");
		assertThat(metrics.ebitdaMargin()).isEqualByComparingTo("-290");
		assertThat(metrics.totalCapex()).isEqualByComparingTo("20000");
		assertThat(metrics.totalCreditsIssued()).isEqualByComparingTo("1000");
		assertThat(metrics.totalPurchasedCredits()).isEqualByComparingTo("200");
		assertThat(metrics.peakFundingRequired()).isCloseTo(new BigDecimal("48523.81"), within(CENT));
		assertThat(metrics.endingCash()).isCloseTo(new BigDecimal("-48523.81"), within(CENT));
		assertThat(metrics.dscrMinimum()).isCloseTo(new BigDecimal("-3.57"), within(CENT));
		assertThat(metrics.equityIrr()).isNull();
		assertThat(metrics.investorIrr()).isNull();
		assertThat(metrics.paybackPeriod()).isNull();
		assertThat(metrics.equityNpv()).isNegative();
	}

	@Test
	void threeYearScenarioPassesEveryStatementCheck() {
		assertThat(invariants.failures(result)).isEmpty();
	}

	@Test
	void computeIsIdempotent() {
		ModelInputs inputs = ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO);

		ModelResult first = engine.compute(inputs);
		ModelResult second = engine.compute(inputs);

		assertThat(second).usingRecursiveComparison().isEqualTo(first);
	}

	@Test
	void noIssuanceMeansNoRevenue() {
		ModelResult noIssuance = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO,
				Map.of("issuance_flag", List.of(0, 0, 0))));

		assertThat(noIssuance.incomeStatements()).allSatisfy(row -> {
			assertThat(row.creditsIssued()).isZero();
			assertThat(row.totalRevenue()).isZero();
		});
		assertThat(invariants.failures(noIssuance)).isEmpty();
	}

	@Test
	void noDebtMeansEmptySchedule() {
		ModelResult noDebt = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO,
				Map.of("debt_draw", List.of(0, 0, 0))));

		assertThat(noDebt.debtSchedule()).allSatisfy(row -> {
			assertThat(row.beginningBalance()).isZero();
			assertThat(row.principalPayment()).isZero();
			assertThat(row.endingBalance()).isZero();
			assertThat(row.interestExpense()).isZero();
			assertThat(row.dscr()).isZero();
		});
		assertThat(noDebt.metrics().dscrMinimum()).isZero();
		assertThat(invariants.failures(noDebt)).isEmpty();
	}

	@Test
	void unearnedRevenueCarriesUntilDelivery() {
		ModelResult carried = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO, Map.of(
				"credits_generated", List.of(0, 0, 1000),
				"issuance_flag", List.of(0, 0, 1),
				"purchase_amount", List.of(2000, 0, 0))));

		assertThat(carried.balanceSheets()).extracting(BalanceSheetRow::getUnearnedRevenue)
				.usingElementComparator(BigDecimal::compareTo)
				.containsExactly(new BigDecimal("2000"), new BigDecimal("2000"), BigDecimal.ZERO);
		assertThat(carried.cashFlowStatements().get(0).changeUnearnedRevenue()).isEqualByComparingTo("2000");
		assertThat(carried.cashFlowStatements().get(2).changeUnearnedRevenue()).isEqualByComparingTo("-2000");
		assertThat(carried.incomeStatements().get(2).prePurchaseRevenue()).isEqualByComparingTo("2000");
		assertThat(carried.carbonStream().get(0).investorCashFlow()).isEqualByComparingTo("-2000");
		assertThat(invariants.failures(carried)).isEmpty();
	}

	@Test
	void openingEquityBalancesWhenFundedByCash() {
		ModelResult funded = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO,
				Map.of("initial_equity_t0", 5000, "opening_cash_y1", 5000)));

		assertThat(funded.balanceSheets()).allSatisfy(row ->
				assertThat(row.getBalanceCheck().abs()).isLessThan(CENT));
		assertThat(funded.balanceSheets().get(0).getContributedCapital()).isEqualByComparingTo("5000");
		assertThat(funded.cashFlowStatements().get(0).cashStart()).isEqualByComparingTo("5000");
	}

	@Test
	void unfundedOpeningEquityShowsConstantBalanceGap() {
		ModelResult unfunded = engine.compute(ModelFixtures.inputs(ModelFixtures.THREE_YEAR_SCENARIO,
				Map.of("initial_equity_t0", 5000)));

		assertThat(unfunded.balanceSheets()).allSatisfy(row ->
				assertThat(row.getBalanceCheck()).isCloseTo(new BigDecimal("-5000"), within(CENT)));
		assertThat(invariants.failures(unfunded)).extracting(InvariantResult::name).containsExactly("balance_check");
	}

	@Test
	void profitableProjectHasReturns() {
		ModelResult profitable = engine.compute(ModelFixtures.inputs(ModelFixtures.PROFITABLE_PROJECT));
		FinancialMetrics metrics = profitable.metrics();

		assertThat(metrics.equityIrr()).isNotNull().isPositive();
		assertThat(metrics.equityNpv()).isPositive();
		assertThat(metrics.paybackPeriod()).isBetween(BigDecimal.ONE, new BigDecimal("2"));
		assertThat(metrics.peakFundingRequired()).isZero();
		assertThat(metrics.investorIrr()).isNull();
		assertThat(metrics.netMargin()).isPositive();
		assertThat(invariants.failures(profitable)).isEmpty();
	}
}

package my.carbonmodel.app.engine;

import my.carbonmodel.app.inputs.ModelInputs;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the three linked statements for one set of inputs.
 * <p>
 * Order is fixed: debt schedule, income statements (need interest), DSCR back-fill (needs
 * EBITDA), balance sheets (need net income and debt balances), cash-flow statements (need balance
 * sheet deltas). The cash-flow pass then settles the cash of each balance-sheet row.
 * <p>
 * Issued credits, the revenue split and the debt periods are computed once in the constructor and
 * reused by every statement. An instance serves a single model run.
 */
public class StatementBuilder {
	private final ModelInputs inputs;
	private final List<BigDecimal> issuedCredits;
	private final RevenueAllocation allocation;
	private final List<DebtPeriod> debtPeriods;

	public StatementBuilder(ModelInputs inputs,
							CreditIssuanceCalculator issuanceCalculator,
							RevenueAllocator revenueAllocator,
							DebtAmortizer debtAmortizer) {
		this.inputs = inputs;
		this.issuedCredits = issuanceCalculator.issue(inputs.creditsGenerated(), inputs.issuanceFlag());
		this.allocation = revenueAllocator.allocate(inputs, issuedCredits);
		this.debtPeriods = debtAmortizer.amortize(inputs.years(), inputs.debtDraw(),
				inputs.interestRate(), inputs.debtDurationYears());
	}

	public FinancialStatements build() {
		List<IncomeStatementRow> incomeStatements = buildIncomeStatements();
		List<DebtScheduleRow> debtSchedule = backfillDscr(incomeStatements);
		List<BalanceSheetRow> balanceSheets = buildBalanceSheets(incomeStatements, debtSchedule);
		List<CashFlowRow> cashFlowStatements = buildCashFlowStatements(incomeStatements, balanceSheets, debtSchedule);
		return new FinancialStatements(issuedCredits, allocation, incomeStatements, balanceSheets,
				cashFlowStatements, debtSchedule);
	}

	List<IncomeStatementRow> buildIncomeStatements() {
		List<IncomeStatementRow> rows = new ArrayList<>(inputs.length());
		for (int t = 0; t < inputs.length(); t++) {
			BigDecimal spotRevenue = allocation.spotRevenue().get(t);
			BigDecimal prePurchaseRevenue = allocation.prePurchaseRevenue().get(t);
			BigDecimal totalRevenue = spotRevenue.add(prePurchaseRevenue);
			BigDecimal cogs = totalRevenue.multiply(inputs.cogsRate());
			BigDecimal grossProfit = totalRevenue.subtract(cogs);
			BigDecimal opexTotal = inputs.opexTotal(t);
			BigDecimal ebitda = grossProfit.add(opexTotal);
			BigDecimal interest = debtPeriods.get(t).interestExpense();
			BigDecimal earningsBeforeTax = ebitda
					.subtract(inputs.depreciation().magnitude(t))
					.subtract(interest.abs());
			// no tax benefit on losses
			BigDecimal incomeTax = Decimals.max(Decimals.ZERO, earningsBeforeTax.multiply(inputs.incomeTaxRate()));
			rows.add(new IncomeStatementRow(
					inputs.years().get(t),
					inputs.creditsGenerated().get(t),
					issuedCredits.get(t),
					spotRevenue,
					prePurchaseRevenue,
					totalRevenue,
					cogs,
					grossProfit,
					inputs.feasibilityCosts().at(t),
					inputs.pddCosts().at(t),
					inputs.mrvCosts().at(t),
					inputs.staffCosts().at(t),
					opexTotal,
					ebitda,
					inputs.depreciation().at(t),
					interest.negate(),
					earningsBeforeTax,
					incomeTax,
					earningsBeforeTax.subtract(incomeTax)
			));
		}
		return rows;
	}

	List<DebtScheduleRow> backfillDscr(List<IncomeStatementRow> incomeStatements) {
		List<DebtScheduleRow> rows = new ArrayList<>(debtPeriods.size());
		for (int t = 0; t < debtPeriods.size(); t++) {
			rows.add(DebtScheduleRow.of(debtPeriods.get(t), incomeStatements.get(t).ebitda()));
		}
		return rows;
	}

	List<BalanceSheetRow> buildBalanceSheets(List<IncomeStatementRow> incomeStatements,
											 List<DebtScheduleRow> debtSchedule) {
		List<BalanceSheetRow> rows = new ArrayList<>(inputs.length());
		BigDecimal ppeGross = inputs.initialPpe();
		BigDecimal accumulatedDepreciation = Decimals.ZERO;
		BigDecimal ppeNet = inputs.initialPpe();
		BigDecimal unearned = Decimals.ZERO;
		BigDecimal retainedEarnings = Decimals.ZERO;
		BigDecimal contributedCapital = inputs.initialEquityT0();
		BigDecimal placeholderCash = inputs.openingCashY1();
		for (int t = 0; t < inputs.length(); t++) {
			IncomeStatementRow income = incomeStatements.get(t);
			ppeGross = ppeGross.add(inputs.capex().magnitude(t));
			accumulatedDepreciation = accumulatedDepreciation.add(inputs.depreciation().magnitude(t));
			ppeNet = ppeNet.subtract(inputs.capex().at(t)).add(inputs.depreciation().at(t));

			BigDecimal accountsReceivable = income.totalRevenue().multiply(inputs.arRate());
			BigDecimal accountsPayable = inputs.apRate().multiply(income.opexTotal().abs());

			unearned = unearned.add(inputs.purchaseAmount().get(t)).subtract(allocation.releasedRevenue(t));
			unearned = Decimals.max(unearned, Decimals.ZERO);

			retainedEarnings = retainedEarnings.add(income.netIncome());
			contributedCapital = contributedCapital.add(inputs.equityInjection().get(t));

			rows.add(new BalanceSheetRow(
					inputs.years().get(t),
					placeholderCash,
					accountsReceivable,
					ppeGross,
					accumulatedDepreciation,
					ppeNet,
					accountsPayable,
					unearned,
					Decimals.max(debtSchedule.get(t).endingBalance(), Decimals.ZERO),
					retainedEarnings,
					contributedCapital
			));
		}
		return rows;
	}

	List<CashFlowRow> buildCashFlowStatements(List<IncomeStatementRow> incomeStatements,
											  List<BalanceSheetRow> balanceSheets,
											  List<DebtScheduleRow> debtSchedule) {
		List<CashFlowRow> rows = new ArrayList<>(inputs.length());
		BigDecimal cashStart = inputs.openingCashY1();
		for (int t = 0; t < inputs.length(); t++) {
			IncomeStatementRow income = incomeStatements.get(t);
			BalanceSheetRow balance = balanceSheets.get(t);
			BalanceSheetRow previous = t > 0 ? balanceSheets.get(t - 1) : null;
			DebtScheduleRow debt = debtSchedule.get(t);

			BigDecimal depreciationAddback = inputs.depreciation().magnitude(t);
			BigDecimal changeReceivable = balance.getAccountsReceivable()
					.subtract(previous == null ? Decimals.ZERO : previous.getAccountsReceivable());
			BigDecimal changePayable = balance.getAccountsPayable()
					.subtract(previous == null ? Decimals.ZERO : previous.getAccountsPayable());
			BigDecimal changeUnearned = balance.getUnearnedRevenue()
					.subtract(previous == null ? Decimals.ZERO : previous.getUnearnedRevenue());
			// interest is expensed in net income but paid under financing
			BigDecimal interestAddback = debt.interestExpense();
			BigDecimal operating = income.netIncome()
					.add(depreciationAddback)
					.add(changePayable)
					.subtract(changeReceivable)
					.add(changeUnearned)
					.add(interestAddback);

			BigDecimal capex = inputs.capex().at(t);
			BigDecimal interestPaid = debt.interestExpense().negate();
			BigDecimal equityInjection = inputs.equityInjection().get(t);
			BigDecimal financing = debt.draw()
					.add(debt.principalPayment())
					.add(interestPaid)
					.add(equityInjection);

			BigDecimal netChange = operating.add(financing).add(capex);
			BigDecimal cashEnd = cashStart.add(netChange);
			balance.settleCash(cashEnd);

			rows.add(new CashFlowRow(
					inputs.years().get(t),
					income.netIncome(),
					depreciationAddback,
					changeReceivable,
					changePayable,
					changeUnearned,
					interestAddback,
					operating,
					capex,
					capex,
					debt.draw(),
					debt.principalPayment(),
					interestPaid,
					equityInjection,
					financing,
					cashStart,
					netChange,
					cashEnd
			));
			cashStart = cashEnd;
		}
		return rows;
	}
}

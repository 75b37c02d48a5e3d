package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-checks the accounting identities that tie the statements of a {@link ModelResult} together.
 * Nothing here changes the result; failures are reported per identity with the offending years.
 */
public class StatementInvariants {
	static final BigDecimal DSCR_TOLERANCE = new BigDecimal("1e-6");
	static final BigDecimal ROLL_TOLERANCE = new BigDecimal("1e-6");

	private final BigDecimal balanceTolerance;

	public StatementInvariants() {
		this(EngineSettings.defaults().balanceTolerance());
	}

	public StatementInvariants(BigDecimal balanceTolerance) {
		this.balanceTolerance = balanceTolerance;
	}

	public List<InvariantResult> check(ModelResult result) {
		List<InvariantResult> results = new ArrayList<>();
		results.add(revenueSplit(result));
		results.add(opexTotal(result));
		results.add(balanceCheck(result));
		results.add(cashTiesOut(result));
		results.add(cashRoll(result));
		results.add(interestSign(result));
		results.add(dscr(result));
		results.add(impliedPriceConstant(result));
		return results;
	}

	public List<InvariantResult> failures(ModelResult result) {
		return check(result).stream().filter(r -> !r.pass()).toList();
	}

	private InvariantResult revenueSplit(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (IncomeStatementRow row : result.incomeStatements()) {
			BigDecimal expected = row.spotRevenue().add(row.prePurchaseRevenue());
			if (row.totalRevenue().compareTo(expected) != 0) {
				details.add(row.year() + ": total_revenue " + row.totalRevenue() + " != " + expected);
			}
		}
		return result("revenue_split", "total_revenue equals spot_revenue plus pre_purchase_revenue", details);
	}

	private InvariantResult opexTotal(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (IncomeStatementRow row : result.incomeStatements()) {
			BigDecimal expected = row.feasibilityCosts().add(row.pddCosts()).add(row.mrvCosts()).add(row.staffCosts());
			if (row.opexTotal().compareTo(expected) != 0) {
				details.add(row.year() + ": opex_total " + row.opexTotal() + " != " + expected);
			}
		}
		return result("opex_total", "opex_total equals the sum of the four cost lines", details);
	}

	private InvariantResult balanceCheck(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (BalanceSheetRow row : result.balanceSheets()) {
			BigDecimal gap = row.getTotalAssets().subtract(row.getTotalLiabilities().add(row.getTotalEquity()));
			if (gap.abs().compareTo(balanceTolerance) > 0) {
				details.add(row.getYear() + ": assets minus liabilities and equity is " + gap);
			}
		}
		return result("balance_check", "total_assets equals total_liabilities plus total_equity", details);
	}

	private InvariantResult cashTiesOut(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (int t = 0; t < result.balanceSheets().size(); t++) {
			BalanceSheetRow balance = result.balanceSheets().get(t);
			CashFlowRow cashFlow = result.cashFlowStatements().get(t);
			if (balance.getCash().subtract(cashFlow.cashEnd()).abs().compareTo(balanceTolerance) > 0) {
				details.add(balance.getYear() + ": balance sheet cash " + balance.getCash()
						+ " != cash_end " + cashFlow.cashEnd());
			}
		}
		return result("cash_ties_out", "balance sheet cash equals cash-flow cash_end", details);
	}

	private InvariantResult cashRoll(ModelResult result) {
		List<String> details = new ArrayList<>();
		BigDecimal expectedStart = result.inputs().openingCashY1();
		for (CashFlowRow row : result.cashFlowStatements()) {
			if (row.cashStart().subtract(expectedStart).abs().compareTo(ROLL_TOLERANCE) > 0) {
				details.add(row.year() + ": cash_start " + row.cashStart() + " != " + expectedStart);
			}
			BigDecimal expectedEnd = row.cashStart()
					.add(row.operatingCashFlow())
					.add(row.investingCashFlow())
					.add(row.financingCashFlow());
			if (row.cashEnd().subtract(expectedEnd).abs().compareTo(ROLL_TOLERANCE) > 0) {
				details.add(row.year() + ": cash_end " + row.cashEnd() + " != " + expectedEnd);
			}
			expectedStart = row.cashEnd();
		}
		return result("cash_roll", "cash_end rolls from cash_start and each cash_start from the prior cash_end", details);
	}

	private InvariantResult interestSign(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (int t = 0; t < result.debtSchedule().size(); t++) {
			DebtScheduleRow debt = result.debtSchedule().get(t);
			IncomeStatementRow income = result.incomeStatements().get(t);
			if (debt.interestExpense().signum() < 0) {
				details.add(debt.year() + ": schedule interest_expense is negative");
			}
			if (income.interestExpense().compareTo(debt.interestExpense().negate()) != 0) {
				details.add(debt.year() + ": income statement interest " + income.interestExpense()
						+ " != -" + debt.interestExpense());
			}
		}
		return result("interest_sign", "income statement interest is the negated schedule interest", details);
	}

	private InvariantResult dscr(ModelResult result) {
		List<String> details = new ArrayList<>();
		for (int t = 0; t < result.debtSchedule().size(); t++) {
			DebtScheduleRow debt = result.debtSchedule().get(t);
			BigDecimal debtService = debt.principalPayment().abs().add(debt.interestExpense());
			BigDecimal expected = debtService.signum() > 0
					? Decimals.divide(result.incomeStatements().get(t).ebitda(), debtService)
					: Decimals.ZERO;
			if (debt.dscr().subtract(expected).abs().compareTo(DSCR_TOLERANCE) > 0) {
				details.add(debt.year() + ": dscr " + debt.dscr() + " != " + expected);
			}
		}
		return result("dscr", "dscr equals ebitda over debt service, or 0 without debt service", details);
	}

	private InvariantResult impliedPriceConstant(ModelResult result) {
		List<String> details = new ArrayList<>();
		List<CarbonStreamRow> rows = result.carbonStream();
		for (CarbonStreamRow row : rows) {
			if (row.impliedPurchasePrice().compareTo(rows.get(0).impliedPurchasePrice()) != 0) {
				details.add(row.year() + ": implied_purchase_price " + row.impliedPurchasePrice()
						+ " != " + rows.get(0).impliedPurchasePrice());
			}
		}
		return result("implied_price_constant", "implied_purchase_price is the same on every carbon stream row", details);
	}

	private static InvariantResult result(String name, String description, List<String> details) {
		return new InvariantResult(name, description, details.isEmpty(), details);
	}
}

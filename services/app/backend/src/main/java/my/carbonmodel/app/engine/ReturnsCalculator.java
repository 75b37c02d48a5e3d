package my.carbonmodel.app.engine;

import my.carbonmodel.app.inputs.ModelInputs;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ReturnsCalculator {
	private static final BigDecimal TWO = BigDecimal.valueOf(2);
	private static final BigDecimal MIN_INTERVAL = new BigDecimal("1e-15");

	private final EngineSettings settings;

	public ReturnsCalculator(EngineSettings settings) {
		this.settings = settings;
	}

	public List<FreeCashFlowRow> freeCashFlow(ModelInputs inputs, FinancialStatements statements) {
		List<FreeCashFlowRow> rows = new ArrayList<>(inputs.length());
		BigDecimal previousWorkingCapital = Decimals.ZERO;
		for (int t = 0; t < inputs.length(); t++) {
			IncomeStatementRow income = statements.incomeStatements().get(t);
			BalanceSheetRow balance = statements.balanceSheets().get(t);
			DebtScheduleRow debt = statements.debtSchedule().get(t);

			BigDecimal workingCapital = balance.getAccountsReceivable().subtract(balance.getAccountsPayable());
			BigDecimal changeWorkingCapital = workingCapital.subtract(previousWorkingCapital);
			BigDecimal depreciationAddback = inputs.depreciation().magnitude(t);
			BigDecimal capex = inputs.capex().at(t);
			BigDecimal netBorrowing = debt.draw().add(debt.principalPayment());
			BigDecimal fcfe = income.netIncome()
					.add(depreciationAddback)
					.subtract(changeWorkingCapital)
					.add(capex)
					.add(netBorrowing);
			rows.add(new FreeCashFlowRow(inputs.years().get(t), income.netIncome(), depreciationAddback,
					changeWorkingCapital, capex, netBorrowing, fcfe));
			previousWorkingCapital = workingCapital;
		}
		return rows;
	}

	/**
	 * Equity cash flows: the opening equity as an outflow at t0, then free cash flow to equity.
	 */
	public List<BigDecimal> equityCashFlows(ModelInputs inputs, List<FreeCashFlowRow> freeCashFlow) {
		List<BigDecimal> series = new ArrayList<>(freeCashFlow.size() + 1);
		series.add(inputs.initialEquityT0().negate());
		for (FreeCashFlowRow row : freeCashFlow) {
			series.add(row.fcfToEquity());
		}
		return series;
	}

	/** Net present value with the first cash flow undiscounted. */
	public BigDecimal npv(List<BigDecimal> cashFlows, BigDecimal rate) {
		BigDecimal base = BigDecimal.ONE.add(rate);
		BigDecimal value = Decimals.ZERO;
		BigDecimal factor = BigDecimal.ONE;
		for (BigDecimal cashFlow : cashFlows) {
			value = value.add(Decimals.divide(cashFlow, factor));
			factor = factor.multiply(base, Decimals.MC);
		}
		return value;
	}

	/**
	 * Bisection over the configured rate bounds. Empty when the cash flows do not change sign
	 * between the bounds or the search does not converge.
	 */
	public Optional<BigDecimal> irr(List<BigDecimal> cashFlows) {
		if (cashFlows == null || !changesSign(cashFlows)) {
			return Optional.empty();
		}
		BigDecimal low = settings.irrLowerBound();
		BigDecimal high = settings.irrUpperBound();
		BigDecimal npvLow = npv(cashFlows, low);
		BigDecimal npvHigh = npv(cashFlows, high);
		if (npvLow.signum() == 0) {
			return Optional.of(low);
		}
		if (npvHigh.signum() == 0) {
			return Optional.of(high);
		}
		if (npvLow.signum() == npvHigh.signum()) {
			return Optional.empty();
		}
		for (int i = 0; i < settings.irrMaxIterations(); i++) {
			BigDecimal mid = Decimals.divide(low.add(high), TWO);
			BigDecimal npvMid = npv(cashFlows, mid);
			if (npvMid.abs().compareTo(settings.irrTolerance()) < 0
					|| high.subtract(low).compareTo(MIN_INTERVAL) < 0) {
				return Optional.of(mid);
			}
			if (npvLow.signum() * npvMid.signum() <= 0) {
				high = mid;
			} else {
				low = mid;
				npvLow = npvMid;
			}
		}
		return Optional.empty();
	}

	/**
	 * Periods until the cumulative cash flow climbs back to zero after turning negative, interpolated
	 * inside the crossing period. Zero when the cumulative flow never goes negative, empty when it
	 * never recovers.
	 */
	public Optional<BigDecimal> payback(List<BigDecimal> cashFlows) {
		BigDecimal cumulative = Decimals.ZERO;
		boolean invested = false;
		for (int t = 0; t < cashFlows.size(); t++) {
			BigDecimal previous = cumulative;
			BigDecimal cashFlow = cashFlows.get(t);
			cumulative = cumulative.add(cashFlow);
			if (cumulative.signum() < 0) {
				invested = true;
			} else if (invested) {
				BigDecimal fraction = Decimals.divide(previous.negate(), cashFlow);
				return Optional.of(BigDecimal.valueOf(t - 1L).add(fraction));
			}
		}
		return invested ? Optional.empty() : Optional.of(Decimals.ZERO);
	}

	private static boolean changesSign(List<BigDecimal> cashFlows) {
		boolean positive = false;
		boolean negative = false;
		for (BigDecimal cashFlow : cashFlows) {
			positive |= cashFlow.signum() > 0;
			negative |= cashFlow.signum() < 0;
		}
		return positive && negative;
	}
}

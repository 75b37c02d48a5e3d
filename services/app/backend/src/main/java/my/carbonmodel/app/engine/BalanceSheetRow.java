package my.carbonmodel.app.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Balance sheet for one year.
 * <p>
 * Cash is the plug of the model: the row is created with a placeholder (the prior year's cash)
 * and receives its real cash exactly once, from the cash-flow pass, through {@link #settleCash}.
 * After that the row is frozen.
 */
@JsonPropertyOrder({"year", "cash", "accounts_receivable", "ppe_gross", "accumulated_depreciation", "ppe_net",
		"total_assets", "accounts_payable", "unearned_revenue", "debt_balance", "total_liabilities",
		"retained_earnings", "contributed_capital", "total_equity", "total_liabilities_equity", "balance_check"})
public final class BalanceSheetRow {
	private final int year;
	private final BigDecimal accountsReceivable;
	private final BigDecimal ppeGross;
	private final BigDecimal accumulatedDepreciation;
	private final BigDecimal ppeNet;
	private final BigDecimal accountsPayable;
	private final BigDecimal unearnedRevenue;
	private final BigDecimal debtBalance;
	private final BigDecimal retainedEarnings;
	private final BigDecimal contributedCapital;

	private BigDecimal cash;
	private BigDecimal totalAssets;
	private BigDecimal totalLiabilitiesEquity;
	private BigDecimal balanceCheck;
	private boolean settled;

	BalanceSheetRow(int year,
					BigDecimal placeholderCash,
					BigDecimal accountsReceivable,
					BigDecimal ppeGross,
					BigDecimal accumulatedDepreciation,
					BigDecimal ppeNet,
					BigDecimal accountsPayable,
					BigDecimal unearnedRevenue,
					BigDecimal debtBalance,
					BigDecimal retainedEarnings,
					BigDecimal contributedCapital) {
		this.year = year;
		this.accountsReceivable = accountsReceivable;
		this.ppeGross = ppeGross;
		this.accumulatedDepreciation = accumulatedDepreciation;
		this.ppeNet = ppeNet;
		this.accountsPayable = accountsPayable;
		this.unearnedRevenue = unearnedRevenue;
		this.debtBalance = debtBalance;
		this.retainedEarnings = retainedEarnings;
		this.contributedCapital = contributedCapital;
		applyCash(placeholderCash);
	}

	void settleCash(BigDecimal cashEnd) {
		if (settled) {
			throw new IllegalStateException("Cash for " + year + " is already settled");
		}
		applyCash(cashEnd);
		settled = true;
	}

	private void applyCash(BigDecimal value) {
		this.cash = value;
		this.totalAssets = value.add(accountsReceivable).add(ppeNet);
		this.totalLiabilitiesEquity = getTotalLiabilities().add(getTotalEquity());
		this.balanceCheck = totalAssets.subtract(totalLiabilitiesEquity);
	}

	@JsonIgnore
	public boolean isSettled() {
		return settled;
	}

	@JsonProperty("year")
	public int getYear() {
		return year;
	}

	@JsonProperty("cash")
	public BigDecimal getCash() {
		return cash;
	}

	@JsonProperty("accounts_receivable")
	public BigDecimal getAccountsReceivable() {
		return accountsReceivable;
	}

	@JsonProperty("ppe_gross")
	public BigDecimal getPpeGross() {
		return ppeGross;
	}

	@JsonProperty("accumulated_depreciation")
	public BigDecimal getAccumulatedDepreciation() {
		return accumulatedDepreciation;
	}

	@JsonProperty("ppe_net")
	public BigDecimal getPpeNet() {
		return ppeNet;
	}

	@JsonProperty("total_assets")
	public BigDecimal getTotalAssets() {
		return totalAssets;
	}

	@JsonProperty("accounts_payable")
	public BigDecimal getAccountsPayable() {
		return accountsPayable;
	}

	@JsonProperty("unearned_revenue")
	public BigDecimal getUnearnedRevenue() {
		return unearnedRevenue;
	}

	@JsonProperty("debt_balance")
	public BigDecimal getDebtBalance() {
		return debtBalance;
	}

	@JsonProperty("total_liabilities")
	public BigDecimal getTotalLiabilities() {
		return accountsPayable.add(unearnedRevenue).add(debtBalance);
	}

	@JsonProperty("retained_earnings")
	public BigDecimal getRetainedEarnings() {
		return retainedEarnings;
	}

	@JsonProperty("contributed_capital")
	public BigDecimal getContributedCapital() {
		return contributedCapital;
	}

	@JsonProperty("total_equity")
	public BigDecimal getTotalEquity() {
		return retainedEarnings.add(contributedCapital);
	}

	@JsonProperty("total_liabilities_equity")
	public BigDecimal getTotalLiabilitiesEquity() {
		return totalLiabilitiesEquity;
	}

	@JsonProperty("balance_check")
	public BigDecimal getBalanceCheck() {
		return balanceCheck;
	}
}

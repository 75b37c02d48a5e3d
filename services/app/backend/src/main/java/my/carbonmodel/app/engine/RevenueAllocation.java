package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Split of issued credits between the spot market and the pre-purchase buyer. Computed once per
 * model run and shared by every statement that needs it.
 *
 * @param purchaseYearIndex index of the single purchase year, or -1 when there is no pre-purchase
 */
public record RevenueAllocation(
		List<BigDecimal> entitlement,
		List<BigDecimal> delivered,
		BigDecimal impliedPurchasePrice,
		List<BigDecimal> spotRevenue,
		List<BigDecimal> prePurchaseRevenue,
		int purchaseYearIndex
) {
	public RevenueAllocation {
		entitlement = List.copyOf(entitlement);
		delivered = List.copyOf(delivered);
		spotRevenue = List.copyOf(spotRevenue);
		prePurchaseRevenue = List.copyOf(prePurchaseRevenue);
	}

	public boolean hasPrePurchase() {
		return purchaseYearIndex >= 0;
	}

	/** Unearned revenue released in year t. */
	public BigDecimal releasedRevenue(int t) {
		return delivered.get(t).multiply(impliedPurchasePrice);
	}
}

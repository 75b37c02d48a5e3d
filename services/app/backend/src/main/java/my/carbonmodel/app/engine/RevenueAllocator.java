package my.carbonmodel.app.engine;

import my.carbonmodel.app.inputs.ModelInputs;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class RevenueAllocator {

	public RevenueAllocation allocate(ModelInputs inputs, List<BigDecimal> issued) {
		int length = issued.size();
		int purchaseYear = firstPurchaseYear(inputs.purchaseAmount());
		BigDecimal share = inputs.purchaseShare();
		if (purchaseYear < 0 || share.signum() == 0) {
			List<BigDecimal> spot = new ArrayList<>(length);
			for (int t = 0; t < length; t++) {
				spot.add(issued.get(t).multiply(inputs.pricePerCredit().get(t)));
			}
			return new RevenueAllocation(Decimals.zeros(length), Decimals.zeros(length), Decimals.ZERO,
					spot, Decimals.zeros(length), -1);
		}

		// The buyer is entitled to its share of every year's issuance, not only the purchase year.
		List<BigDecimal> entitlement = new ArrayList<>(length);
		for (BigDecimal credits : issued) {
			entitlement.add(credits.multiply(share));
		}
		BigDecimal totalEntitlement = Decimals.sum(entitlement);
		BigDecimal purchaseCash = inputs.purchaseAmount().get(purchaseYear);
		BigDecimal impliedPrice = totalEntitlement.signum() > 0
				? Decimals.divide(purchaseCash, totalEntitlement)
				: Decimals.ZERO;

		List<BigDecimal> delivered = new ArrayList<>(length);
		List<BigDecimal> spot = new ArrayList<>(length);
		List<BigDecimal> prePurchase = new ArrayList<>(length);
		BigDecimal remainingEntitlement = totalEntitlement;
		for (int t = 0; t < length; t++) {
			BigDecimal delivery = Decimals.max(Decimals.min(entitlement.get(t), remainingEntitlement), Decimals.ZERO);
			remainingEntitlement = remainingEntitlement.subtract(delivery);
			delivered.add(delivery);
			spot.add(issued.get(t).subtract(delivery).multiply(inputs.pricePerCredit().get(t)));
			prePurchase.add(delivery.multiply(impliedPrice));
		}
		return new RevenueAllocation(entitlement, delivered, impliedPrice, spot, prePurchase, purchaseYear);
	}

	private static int firstPurchaseYear(List<BigDecimal> purchaseAmounts) {
		for (int t = 0; t < purchaseAmounts.size(); t++) {
			if (purchaseAmounts.get(t).signum() > 0) {
				return t;
			}
		}
		return -1;
	}
}

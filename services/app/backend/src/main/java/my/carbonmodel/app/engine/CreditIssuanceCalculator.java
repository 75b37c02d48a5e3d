package my.carbonmodel.app.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class CreditIssuanceCalculator {

	/**
	 * Issues the whole unissued inventory in every flagged year. Cumulative issuance never
	 * exceeds cumulative generation.
	 */
	public List<BigDecimal> issue(List<BigDecimal> creditsGenerated, List<Integer> issuanceFlags) {
		List<BigDecimal> issued = new ArrayList<>(creditsGenerated.size());
		BigDecimal cumulativeGenerated = Decimals.ZERO;
		BigDecimal cumulativeIssued = Decimals.ZERO;
		for (int t = 0; t < creditsGenerated.size(); t++) {
			cumulativeGenerated = cumulativeGenerated.add(creditsGenerated.get(t));
			BigDecimal remaining = cumulativeGenerated.subtract(cumulativeIssued);
			BigDecimal candidate = remaining.multiply(BigDecimal.valueOf(issuanceFlags.get(t)));
			BigDecimal amount = Decimals.min(Decimals.max(candidate, Decimals.ZERO), Decimals.max(remaining, Decimals.ZERO));
			issued.add(amount);
			cumulativeIssued = cumulativeIssued.add(amount);
		}
		return List.copyOf(issued);
	}
}

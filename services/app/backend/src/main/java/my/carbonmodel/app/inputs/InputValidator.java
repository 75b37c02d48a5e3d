package my.carbonmodel.app.inputs;

import my.carbonmodel.app.engine.DebtAmortizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fail-fast checks on a submitted {@link ModelInputsDocument}, and its conversion into {@link ModelInputs}.
 */
public class InputValidator {
	private static final BigDecimal ONE = BigDecimal.ONE;

	private static final Map<String, Function<ModelInputsDocument, BigDecimal>> RATES = rates();
	private static final Map<String, Function<ModelInputsDocument, List<BigDecimal>>> SERIES = series();
	private static final List<String> NEGATIVE_LINES = List.of(
			"feasibility_costs", "pdd_costs", "mrv_costs", "staff_costs", "depreciation", "capex");
	private static final List<String> NON_NEGATIVE_LINES = List.of(
			"credits_generated", "debt_draw", "purchase_amount");

	private final BigDecimal balanceTolerance;

	public InputValidator() {
		this(new BigDecimal("0.01"));
	}

	public InputValidator(BigDecimal balanceTolerance) {
		this.balanceTolerance = balanceTolerance;
	}

	public List<String> validate(ModelInputsDocument document) {
		List<String> errors = new ArrayList<>();
		if (document == null) {
			errors.add("Model inputs are empty");
			return errors;
		}
		List<BigDecimal> years = document.years();
		if (years == null || years.isEmpty()) {
			errors.add("years must contain at least one year");
			return errors;
		}
		for (int i = 0; i < years.size(); i++) {
			BigDecimal year = years.get(i);
			if (year == null) {
				errors.add("years[" + i + "] is required");
			} else if (!isInteger(year) || !fitsInt(year)) {
				errors.add("years[" + i + "] must be an integer");
			}
		}
		for (int i = 1; i < years.size(); i++) {
			if (years.get(i - 1) != null && years.get(i) != null && years.get(i).compareTo(years.get(i - 1)) <= 0) {
				errors.add("years must be strictly increasing");
				break;
			}
		}
		int length = years.size();

		Map<String, List<BigDecimal>> complete = new LinkedHashMap<>();
		for (Map.Entry<String, Function<ModelInputsDocument, List<BigDecimal>>> entry : SERIES.entrySet()) {
			String name = entry.getKey();
			List<BigDecimal> values = entry.getValue().apply(document);
			if (values == null) {
				errors.add(name + " is required");
				continue;
			}
			if (values.size() != length) {
				errors.add("Length of " + name + " must equal years.length (" + length + ")");
				continue;
			}
			int missing = firstNull(values);
			if (missing >= 0) {
				errors.add(name + "[" + missing + "] must be a number");
				continue;
			}
			complete.put(name, values);
		}

		for (Map.Entry<String, Function<ModelInputsDocument, BigDecimal>> entry : RATES.entrySet()) {
			BigDecimal rate = entry.getValue().apply(document);
			if (rate == null) {
				errors.add(entry.getKey() + " is required");
			} else if (rate.signum() < 0 || rate.compareTo(ONE) > 0) {
				errors.add(entry.getKey() + " must be between 0 and 1");
			}
		}

		BigDecimal duration = document.debtDurationYears();
		if (duration == null) {
			errors.add("debt_duration_years is required");
		} else if (duration.signum() <= 0 || !isInteger(duration)) {
			errors.add("debt_duration_years must be a positive integer");
		} else if (duration.compareTo(BigDecimal.valueOf(DebtAmortizer.MAX_DURATION_YEARS)) > 0) {
			errors.add("debt_duration_years must be at most " + DebtAmortizer.MAX_DURATION_YEARS);
		}

		List<BigDecimal> flags = complete.get("issuance_flag");
		if (flags != null) {
			for (int i = 0; i < flags.size(); i++) {
				BigDecimal flag = flags.get(i);
				if (flag.compareTo(BigDecimal.ZERO) != 0 && flag.compareTo(ONE) != 0) {
					errors.add("issuance_flag[" + i + "] must be 0 or 1");
				}
			}
		}
		for (String name : NEGATIVE_LINES) {
			List<BigDecimal> values = complete.get(name);
			if (values == null) {
				continue;
			}
			for (int i = 0; i < values.size(); i++) {
				if (values.get(i).signum() > 0) {
					errors.add(name + "[" + i + "] must be zero or negative");
				}
			}
		}
		for (String name : NON_NEGATIVE_LINES) {
			List<BigDecimal> values = complete.get(name);
			if (values == null) {
				continue;
			}
			for (int i = 0; i < values.size(); i++) {
				if (values.get(i).signum() < 0) {
					errors.add(name + "[" + i + "] must not be negative");
				}
			}
		}

		List<BigDecimal> purchases = complete.get("purchase_amount");
		if (purchases != null) {
			if (countNonZero(purchases) > 1) {
				errors.add("purchase_amount may be non-zero in at most one year");
			}
			BigDecimal share = document.purchaseShare();
			boolean anyPurchase = purchases.stream().anyMatch(value -> value.signum() > 0);
			if (anyPurchase && share != null && share.signum() == 0) {
				errors.add("purchase_share must be greater than 0 when purchase_amount is set");
			}
		}
		List<BigDecimal> draws = complete.get("debt_draw");
		if (draws != null && countNonZero(draws) > 1) {
			errors.add("debt_draw may be non-zero in at most one year");
		}
		return errors;
	}

	/**
	 * Validates and converts. Throws with every collected message if the document is invalid.
	 */
	public ModelInputs normalize(ModelInputsDocument document) {
		List<String> errors = validate(document);
		if (!errors.isEmpty()) {
			throw new InputValidationException(errors);
		}
		return toInputs(document);
	}

	/**
	 * Converts a document for which {@link #validate} returned no errors.
	 */
	public ModelInputs toInputs(ModelInputsDocument document) {
		return new ModelInputs(
				document.years().stream().map(BigDecimal::intValueExact).toList(),
				document.creditsGenerated(),
				document.pricePerCredit(),
				document.issuanceFlag().stream().map(BigDecimal::intValueExact).toList(),
				document.cogsRate(),
				new NegativeSeries(document.feasibilityCosts()),
				new NegativeSeries(document.pddCosts()),
				new NegativeSeries(document.mrvCosts()),
				new NegativeSeries(document.staffCosts()),
				new NegativeSeries(document.depreciation()),
				document.incomeTaxRate(),
				document.arRate(),
				document.apRate(),
				new NegativeSeries(document.capex()),
				document.equityInjection(),
				document.interestRate(),
				document.debtDurationYears().intValueExact(),
				document.debtDraw(),
				document.purchaseAmount(),
				document.purchaseShare(),
				document.discountRate(),
				orZero(document.initialEquityT0()),
				orZero(document.openingCashY1()),
				orZero(document.initialPpe())
		);
	}

	/**
	 * Non-fatal checks. Year 0 balances only when opening cash plus opening PP&amp;E equals the
	 * opening equity; any difference shows up as a constant balance_check later.
	 */
	public List<String> advisories(ModelInputs inputs) {
		BigDecimal required = inputs.initialEquityT0().subtract(inputs.initialPpe());
		BigDecimal difference = inputs.openingCashY1().subtract(required);
		if (difference.abs().compareTo(balanceTolerance) > 0) {
			return List.of("opening_cash_y1 is " + inputs.openingCashY1().toPlainString()
					+ " but " + required.toPlainString()
					+ " (initial_equity_t0 - initial_ppe) is needed to balance; balance_check will be off by "
					+ difference.toPlainString());
		}
		return Collections.emptyList();
	}

	private static boolean isInteger(BigDecimal value) {
		return value.stripTrailingZeros().scale() <= 0;
	}

	private static boolean fitsInt(BigDecimal value) {
		return value.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) >= 0
				&& value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0;
	}

	private static int firstNull(List<BigDecimal> values) {
		for (int i = 0; i < values.size(); i++) {
			if (values.get(i) == null) {
				return i;
			}
		}
		return -1;
	}

	private static long countNonZero(List<BigDecimal> values) {
		return values.stream().filter(value -> value.signum() != 0).count();
	}

	private static BigDecimal orZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}

	private static Map<String, Function<ModelInputsDocument, BigDecimal>> rates() {
		Map<String, Function<ModelInputsDocument, BigDecimal>> rates = new LinkedHashMap<>();
		rates.put("cogs_rate", ModelInputsDocument::cogsRate);
		rates.put("income_tax_rate", ModelInputsDocument::incomeTaxRate);
		rates.put("ar_rate", ModelInputsDocument::arRate);
		rates.put("ap_rate", ModelInputsDocument::apRate);
		rates.put("interest_rate", ModelInputsDocument::interestRate);
		rates.put("purchase_share", ModelInputsDocument::purchaseShare);
		rates.put("discount_rate", ModelInputsDocument::discountRate);
		return Collections.unmodifiableMap(rates);
	}

	private static Map<String, Function<ModelInputsDocument, List<BigDecimal>>> series() {
		Map<String, Function<ModelInputsDocument, List<BigDecimal>>> series = new LinkedHashMap<>();
		series.put("credits_generated", ModelInputsDocument::creditsGenerated);
		series.put("price_per_credit", ModelInputsDocument::pricePerCredit);
		series.put("issuance_flag", ModelInputsDocument::issuanceFlag);
		series.put("feasibility_costs", ModelInputsDocument::feasibilityCosts);
		series.put("pdd_costs", ModelInputsDocument::pddCosts);
		series.put("mrv_costs", ModelInputsDocument::mrvCosts);
		series.put("staff_costs", ModelInputsDocument::staffCosts);
		series.put("depreciation", ModelInputsDocument::depreciation);
		series.put("capex", ModelInputsDocument::capex);
		series.put("equity_injection", ModelInputsDocument::equityInjection);
		series.put("debt_draw", ModelInputsDocument::debtDraw);
		series.put("purchase_amount", ModelInputsDocument::purchaseAmount);
		return Collections.unmodifiableMap(series);
	}
}

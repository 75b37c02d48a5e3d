package my.carbonmodel.app.service;

import java.util.Locale;

public enum StatementType {
	INCOME_STATEMENT("income-statement"),
	BALANCE_SHEET("balance-sheet"),
	CASH_FLOW("cash-flow"),
	DEBT_SCHEDULE("debt-schedule"),
	CARBON_STREAM("carbon-stream"),
	FREE_CASH_FLOW("free-cash-flow");

	private final String slug;

	StatementType(String slug) {
		this.slug = slug;
	}

	public String getSlug() {
		return slug;
	}

	public static StatementType fromSlug(String value) {
		if (value != null) {
			String normalized = value.trim().toLowerCase(Locale.ROOT);
			for (StatementType type : values()) {
				if (type.slug.equals(normalized)) {
					return type;
				}
			}
		}
		throw new IllegalArgumentException("Unknown statement: " + value);
	}
}

package spml.model.spel;

public enum SpelConditionOperator {
	AND("&&"),
	OR("||");

	private final String symbol;

	SpelConditionOperator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}
}

package spml.model.spel;

public enum SpelComparisonOperator {
	EQUAL("=="),
	UNEQUAL("!="),
	GREATER_THAN(">"),
	GREATER_THAN_OR_EQUAL(">="),
	LESS_THAN("<"),
	LESS_THAN_OR_EQUAL("<=");

	private final String symbol;

	SpelComparisonOperator(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}
}

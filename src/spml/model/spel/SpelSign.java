package spml.model.spel;

public enum SpelSign {
	PLUS("+"),
	MINUS("-");

	private final String symbol;

	SpelSign(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}
}

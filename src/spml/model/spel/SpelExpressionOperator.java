package spml.model.spel;

import java.util.Optional;

public enum SpelExpressionOperator {
	ADDITION('+', 1),
	SUBTRACTION('-', 1),
	DIVISION('/', 2),
	MULTIPLICATION('*', 2),
	MODULO('%', 2),
	POWER('^', 3);

	private final char symbol;
	private final int bindingStrength;

	SpelExpressionOperator(char symbol, int bindingStrength) {
		this.symbol = symbol;
		this.bindingStrength = bindingStrength;
	}

	public char getSymbol() {
		return symbol;
	}

	/**
	 * Operators with a higher binding strength bind their operands tighter. Operators of equal strength associate
	 * left to right.
	 */
	public int getBindingStrength() {
		return bindingStrength;
	}

	public boolean bindsAtLeastAsTightAs(SpelExpressionOperator other) {
		return bindingStrength >= other.bindingStrength;
	}

	public static Optional<SpelExpressionOperator> fromSymbol(char c) {
		for (SpelExpressionOperator operator : values()) {
			if (operator.symbol == c) {
				return Optional.of(operator);
			}
		}
		return Optional.empty();
	}
}

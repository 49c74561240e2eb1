package spml.model.spel;

import java.util.Objects;

public class SpelSignedNumber extends SpelNode implements SpelArgument {
	private final SpelSign sign;
	private final SpelLocation signLocation;
	private final SpelNumber number;

	public SpelSignedNumber(SpelSign sign, SpelLocation signLocation, SpelNumber number) {
		this.sign = sign;
		this.signLocation = signLocation;
		this.number = number;
	}

	public SpelSign getSign() {
		return sign;
	}

	public SpelLocation getSignLocation() {
		return signLocation;
	}

	public SpelNumber getNumber() {
		return number;
	}

	@Override
	public int getStartCharacter() {
		return signLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return number.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "expression";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelSignedNumber that = (SpelSignedNumber) o;
		return Objects.equals(sign, that.sign) &&
				Objects.equals(signLocation, that.signLocation) &&
				Objects.equals(number, that.number);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sign, signLocation, number);
	}
}

package spml.model.schema;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A cross-attribute constraint of a tag, such as "exactly one of these attributes". Rules are carried for
 * validators and never consulted while parsing.
 */
public class AttributeRule {
	private final String rule;
	private final List<Argument> arguments;

	public AttributeRule(String rule, List<Argument> arguments) {
		this.rule = rule;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public String getRule() {
		return rule;
	}

	public List<Argument> getArguments() {
		return arguments;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AttributeRule that = (AttributeRule) o;
		return rule.equals(that.rule) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rule, arguments);
	}

	@Override
	public String toString() {
		return rule + arguments;
	}

	/**
	 * Either a single value or a list of values.
	 */
	public static class Argument {
		private final List<String> values;
		private final boolean list;

		private Argument(List<String> values, boolean list) {
			this.values = values;
			this.list = list;
		}

		public static Argument single(String value) {
			return new Argument(Collections.singletonList(value), false);
		}

		public static Argument list(List<String> values) {
			return new Argument(Collections.unmodifiableList(values), true);
		}

		public boolean isList() {
			return list;
		}

		public String getValue() {
			if (list) {
				throw new IllegalStateException("argument is a list: " + values);
			}
			return values.get(0);
		}

		public List<String> getValues() {
			return values;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Argument argument = (Argument) o;
			return list == argument.list && values.equals(argument.values);
		}

		@Override
		public int hashCode() {
			return Objects.hash(values, list);
		}

		@Override
		public String toString() {
			return list ? values.toString() : values.get(0);
		}
	}
}

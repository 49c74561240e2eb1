package spml.model.document;

import spml.errors.ParseIssue;
import spml.util.Position;
import spml.util.Ranged;
import spml.util.Span;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The recovery wrapper around every parsed construct: a value that conforms to the grammar, a value that could
 * only be built by tolerating issues, or no value at all.
 *
 * Issues are never dropped. A value with issues is never reported as valid.
 */
public abstract class Parsed<T extends Ranged> implements Ranged {

	Parsed() {
	}

	public static <T extends Ranged> Valid<T> valid(T value) {
		return new Valid<>(value);
	}

	public static <T extends Ranged> Erroneous<T> erroneous(T value, List<ParseIssue> issues) {
		return new Erroneous<>(value, issues);
	}

	public static <T extends Ranged> Unparsable<T> unparsable(String message, Span span) {
		return new Unparsable<>(message, span);
	}

	/**
	 * @return Valid if there are no issues, Erroneous otherwise
	 */
	public static <T extends Ranged> Parsed<T> of(T value, List<ParseIssue> issues) {
		if (issues.isEmpty()) {
			return valid(value);
		}
		return erroneous(value, issues);
	}

	public abstract Optional<T> getValue();

	public abstract List<ParseIssue> getIssues();

	public boolean isValid() {
		return false;
	}

	public boolean isUnparsable() {
		return false;
	}

	public static final class Valid<T extends Ranged> extends Parsed<T> {
		private final T value;

		public Valid(T value) {
			this.value = value;
		}

		@Override
		public Optional<T> getValue() {
			return Optional.of(value);
		}

		@Override
		public List<ParseIssue> getIssues() {
			return Collections.emptyList();
		}

		@Override
		public boolean isValid() {
			return true;
		}

		@Override
		public Position start() {
			return value.start();
		}

		@Override
		public Position end() {
			return value.end();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return value.equals(((Valid<?>) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(value);
		}

		@Override
		public String toString() {
			return "Valid(" + value + ")";
		}
	}

	public static final class Erroneous<T extends Ranged> extends Parsed<T> {
		private final T value;
		private final List<ParseIssue> issues;

		public Erroneous(T value, List<ParseIssue> issues) {
			if (issues.isEmpty()) {
				throw new IllegalArgumentException("an erroneous value needs at least one issue");
			}
			this.value = value;
			this.issues = Collections.unmodifiableList(issues);
		}

		@Override
		public Optional<T> getValue() {
			return Optional.of(value);
		}

		@Override
		public List<ParseIssue> getIssues() {
			return issues;
		}

		@Override
		public Position start() {
			return value.start();
		}

		@Override
		public Position end() {
			return value.end();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Erroneous<?> that = (Erroneous<?>) o;
			return value.equals(that.value) && issues.equals(that.issues);
		}

		@Override
		public int hashCode() {
			return Objects.hash(value, issues);
		}

		@Override
		public String toString() {
			return "Erroneous(" + value + ", " + issues + ")";
		}
	}

	public static final class Unparsable<T extends Ranged> extends Parsed<T> {
		private final String message;
		private final Span span;

		public Unparsable(String message, Span span) {
			this.message = message;
			this.span = span;
		}

		public String getMessage() {
			return message;
		}

		public Span getSpan() {
			return span;
		}

		@Override
		public Optional<T> getValue() {
			return Optional.empty();
		}

		@Override
		public List<ParseIssue> getIssues() {
			return Collections.emptyList();
		}

		@Override
		public boolean isUnparsable() {
			return true;
		}

		@Override
		public Position start() {
			return span.start();
		}

		@Override
		public Position end() {
			return span.end();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Unparsable<?> that = (Unparsable<?>) o;
			return message.equals(that.message) && span.equals(that.span);
		}

		@Override
		public int hashCode() {
			return Objects.hash(message, span);
		}

		@Override
		public String toString() {
			return "Unparsable(\"" + message + "\", " + span + ")";
		}
	}
}

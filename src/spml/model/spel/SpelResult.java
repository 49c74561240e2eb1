package spml.model.spel;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of parsing one SPEL text: either a syntax tree or the first syntax error encountered.
 */
public abstract class SpelResult<T extends SpelElement> {

	public abstract boolean isValid();

	public abstract Optional<T> getRoot();

	public abstract Optional<SpelSyntaxError> getError();

	public static <T extends SpelElement> Valid<T> valid(T root) {
		return new Valid<>(root);
	}

	public static <T extends SpelElement> Invalid<T> invalid(SpelSyntaxError error) {
		return new Invalid<>(error);
	}

	public static class Valid<T extends SpelElement> extends SpelResult<T> {
		private final T root;

		public Valid(T root) {
			this.root = root;
		}

		@Override
		public boolean isValid() {
			return true;
		}

		@Override
		public Optional<T> getRoot() {
			return Optional.of(root);
		}

		@Override
		public Optional<SpelSyntaxError> getError() {
			return Optional.empty();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Valid<?> valid = (Valid<?>) o;
			return Objects.equals(root, valid.root);
		}

		@Override
		public int hashCode() {
			return Objects.hash(root);
		}

		@Override
		public String toString() {
			return "Valid(" + root + ")";
		}
	}

	public static class Invalid<T extends SpelElement> extends SpelResult<T> {
		private final SpelSyntaxError error;

		public Invalid(SpelSyntaxError error) {
			this.error = error;
		}

		@Override
		public boolean isValid() {
			return false;
		}

		@Override
		public Optional<T> getRoot() {
			return Optional.empty();
		}

		@Override
		public Optional<SpelSyntaxError> getError() {
			return Optional.of(error);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Invalid<?> invalid = (Invalid<?>) o;
			return Objects.equals(error, invalid.error);
		}

		@Override
		public int hashCode() {
			return Objects.hash(error);
		}

		@Override
		public String toString() {
			return "Invalid(" + error + ")";
		}
	}
}

package spml.model.spel;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class SpelSyntaxError {
	private final String message;
	private final List<SpelSyntaxFix> proposedFixes;

	public SpelSyntaxError(String message, List<SpelSyntaxFix> proposedFixes) {
		this.message = message;
		this.proposedFixes = proposedFixes;
	}

	public SpelSyntaxError(String message) {
		this(message, Collections.emptyList());
	}

	public String getMessage() {
		return message;
	}

	public List<SpelSyntaxFix> getProposedFixes() {
		return proposedFixes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelSyntaxError that = (SpelSyntaxError) o;
		return Objects.equals(message, that.message) && Objects.equals(proposedFixes, that.proposedFixes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(message, proposedFixes);
	}

	@Override
	public String toString() {
		return message;
	}
}

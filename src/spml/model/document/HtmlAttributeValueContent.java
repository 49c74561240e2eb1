package spml.model.document;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The content between the quotes of an html attribute value. Plain text and SPML tags can be mixed freely, the
 * content keeps them in source order.
 */
public abstract class HtmlAttributeValueContent {

	HtmlAttributeValueContent() {
	}

	public static HtmlAttributeValueContent of(List<HtmlAttributeValueFragment> fragments) {
		switch (fragments.size()) {
			case 0:
				return new Empty();
			case 1:
				return fragments.get(0).toContent();
			default:
				return new Fragmented(fragments);
		}
	}

	public abstract List<HtmlAttributeValueFragment> getFragments();

	public static final class Empty extends HtmlAttributeValueContent {
		@Override
		public List<HtmlAttributeValueFragment> getFragments() {
			return Collections.emptyList();
		}

		@Override
		public boolean equals(Object o) {
			return o != null && getClass() == o.getClass();
		}

		@Override
		public int hashCode() {
			return 0;
		}

		@Override
		public String toString() {
			return "\"\"";
		}
	}

	public static final class Plain extends HtmlAttributeValueContent {
		private final String text;

		public Plain(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		@Override
		public List<HtmlAttributeValueFragment> getFragments() {
			return Collections.singletonList(new HtmlAttributeValueFragment.Plain(text));
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return text.equals(((Plain) o).text);
		}

		@Override
		public int hashCode() {
			return text.hashCode();
		}

		@Override
		public String toString() {
			return "\"" + text + "\"";
		}
	}

	public static final class SingleTag extends HtmlAttributeValueContent {
		private final Parsed<Tag> tag;

		public SingleTag(Parsed<Tag> tag) {
			this.tag = tag;
		}

		public Parsed<Tag> getTag() {
			return tag;
		}

		@Override
		public List<HtmlAttributeValueFragment> getFragments() {
			return Collections.singletonList(new HtmlAttributeValueFragment.TagFragment(tag));
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return tag.equals(((SingleTag) o).tag);
		}

		@Override
		public int hashCode() {
			return tag.hashCode();
		}

		@Override
		public String toString() {
			return "\"" + tag + "\"";
		}
	}

	public static final class Fragmented extends HtmlAttributeValueContent {
		private final List<HtmlAttributeValueFragment> fragments;

		public Fragmented(List<HtmlAttributeValueFragment> fragments) {
			this.fragments = Collections.unmodifiableList(fragments);
		}

		@Override
		public List<HtmlAttributeValueFragment> getFragments() {
			return fragments;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return fragments.equals(((Fragmented) o).fragments);
		}

		@Override
		public int hashCode() {
			return Objects.hash(fragments);
		}

		@Override
		public String toString() {
			return fragments.toString();
		}
	}
}

package spml.model.document;

public abstract class HtmlAttributeValueFragment {

	HtmlAttributeValueFragment() {
	}

	abstract HtmlAttributeValueContent toContent();

	public static final class Plain extends HtmlAttributeValueFragment {
		private final String text;

		public Plain(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		@Override
		HtmlAttributeValueContent toContent() {
			return new HtmlAttributeValueContent.Plain(text);
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
			return "Plain(\"" + text + "\")";
		}
	}

	public static final class TagFragment extends HtmlAttributeValueFragment {
		private final Parsed<Tag> tag;

		public TagFragment(Parsed<Tag> tag) {
			this.tag = tag;
		}

		public Parsed<Tag> getTag() {
			return tag;
		}

		@Override
		HtmlAttributeValueContent toContent() {
			return new HtmlAttributeValueContent.SingleTag(tag);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return tag.equals(((TagFragment) o).tag);
		}

		@Override
		public int hashCode() {
			return tag.hashCode();
		}

		@Override
		public String toString() {
			return "Tag(" + tag + ")";
		}
	}
}

package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A java page directive, "&lt;%@ page ... %&gt;".
 */
public class PageHeader implements Ranged {
	private final SingleLineSpan openBracket;
	private final SingleLineSpan page;
	private final Parsed<PlainAttribute> contentType;
	private final Parsed<PlainAttribute> language;
	private final Parsed<PlainAttribute> pageEncoding;
	private final List<Parsed<PlainAttribute>> imports;
	private final SingleLineSpan closeBracket;

	public PageHeader(SingleLineSpan openBracket, SingleLineSpan page, Parsed<PlainAttribute> contentType,
	                  Parsed<PlainAttribute> language, Parsed<PlainAttribute> pageEncoding,
	                  List<Parsed<PlainAttribute>> imports, SingleLineSpan closeBracket) {
		this.openBracket = openBracket;
		this.page = page;
		this.contentType = contentType;
		this.language = language;
		this.pageEncoding = pageEncoding;
		this.imports = Collections.unmodifiableList(imports);
		this.closeBracket = closeBracket;
	}

	public SingleLineSpan getOpenBracket() {
		return openBracket;
	}

	public SingleLineSpan getPage() {
		return page;
	}

	public Optional<Parsed<PlainAttribute>> getContentType() {
		return Optional.ofNullable(contentType);
	}

	public Optional<Parsed<PlainAttribute>> getLanguage() {
		return Optional.ofNullable(language);
	}

	public Optional<Parsed<PlainAttribute>> getPageEncoding() {
		return Optional.ofNullable(pageEncoding);
	}

	public List<Parsed<PlainAttribute>> getImports() {
		return imports;
	}

	public SingleLineSpan getCloseBracket() {
		return closeBracket;
	}

	@Override
	public Position start() {
		return openBracket.start();
	}

	@Override
	public Position end() {
		return closeBracket.end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PageHeader that = (PageHeader) o;
		return openBracket.equals(that.openBracket) && page.equals(that.page)
				&& Objects.equals(contentType, that.contentType) && Objects.equals(language, that.language)
				&& Objects.equals(pageEncoding, that.pageEncoding) && imports.equals(that.imports)
				&& closeBracket.equals(that.closeBracket);
	}

	@Override
	public int hashCode() {
		return Objects.hash(openBracket, page, contentType, language, pageEncoding, imports, closeBracket);
	}
}

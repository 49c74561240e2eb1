package spml.model.document;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Header {
	private final List<Parsed<PageHeader>> pageHeaders;
	private final List<Parsed<TagLibImport>> tagLibImports;

	public Header(List<Parsed<PageHeader>> pageHeaders, List<Parsed<TagLibImport>> tagLibImports) {
		this.pageHeaders = Collections.unmodifiableList(pageHeaders);
		this.tagLibImports = Collections.unmodifiableList(tagLibImports);
	}

	public List<Parsed<PageHeader>> getPageHeaders() {
		return pageHeaders;
	}

	public List<Parsed<TagLibImport>> getTagLibImports() {
		return tagLibImports;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Header header = (Header) o;
		return pageHeaders.equals(header.pageHeaders) && tagLibImports.equals(header.tagLibImports);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pageHeaders, tagLibImports);
	}
}

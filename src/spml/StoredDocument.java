package spml;

import spml.model.document.Document;

/**
 * A source text together with the document parsed from it.
 */
public class StoredDocument {
	private final String text;
	private final Document document;
	private final long version;

	/**
	 * @param version orders updates of the same document, higher is newer
	 */
	public StoredDocument(String text, Document document, long version) {
		this.text = text;
		this.document = document;
		this.version = version;
	}

	public long getVersion() {
		return version;
	}

	public String getText() {
		return text;
	}

	public Document getDocument() {
		return document;
	}
}

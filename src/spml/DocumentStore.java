package spml;

import spml.model.document.Document;
import spml.model.schema.TagSchema;
import spml.parser.DocumentParser;
import spml.parser.SpmlParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Parsed documents by URI. Every update re-parses the whole text. All access goes through one lock, parsing
 * itself happens outside of it. Updates are numbered when they start, so an update whose parse finishes late never
 * replaces a newer one.
 */
public class DocumentStore {
	private static final Logger logger = Logger.getLogger(DocumentStore.class.getName());

	private final TagSchema schema;
	private final Map<String, StoredDocument> documents = new HashMap<>();
	private final Object lock = new Object();
	private final AtomicLong versions = new AtomicLong();

	public DocumentStore(TagSchema schema) {
		this.schema = schema;
	}

	/**
	 * Parses text and stores the result under uri, replacing any older version. If the text cannot be parsed at
	 * all, the previous version is kept.
	 *
	 * @return the version stored under uri afterwards, which is a newer one if a later update finished first
	 */
	public StoredDocument put(String uri, String text) throws SpmlParseException {
		long version = versions.incrementAndGet();
		Document document = DocumentParser.parse(text, schema);
		return store(uri, new StoredDocument(text, document, version));
	}

	StoredDocument store(String uri, StoredDocument stored) {
		synchronized (lock) {
			StoredDocument current = documents.get(uri);
			if (current != null && current.getVersion() > stored.getVersion()) {
				logger.fine("dropped outdated version " + stored.getVersion() + " of " + uri);
				return current;
			}
			documents.put(uri, stored);
		}
		logger.fine("stored version " + stored.getVersion() + " of " + uri);
		return stored;
	}

	public Optional<StoredDocument> get(String uri) {
		synchronized (lock) {
			return Optional.ofNullable(documents.get(uri));
		}
	}

	public Optional<StoredDocument> remove(String uri) {
		synchronized (lock) {
			return Optional.ofNullable(documents.remove(uri));
		}
	}

	public List<String> uris() {
		synchronized (lock) {
			return new ArrayList<>(documents.keySet());
		}
	}
}

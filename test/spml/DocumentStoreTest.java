package spml;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import spml.model.document.HtmlNode;
import spml.model.schema.TagSchema;
import spml.parser.SpmlParseException;

public class DocumentStoreTest {
	private DocumentStore store;

	@Before
	public void setUp() throws IOException {
		store = new DocumentStore(TagSchema.load());
	}

	@Test
	public void putAndGet() throws SpmlParseException {
		StoredDocument stored = store.put("file:///a.spml", "<div>a</div>");
		assertThat(stored.getText(), is("<div>a</div>"));
		assertThat(stored.getDocument().getNodes().get(0), instanceOf(HtmlNode.class));
		assertThat(store.get("file:///a.spml").get(), sameInstance(stored));
		assertFalse(store.get("file:///b.spml").isPresent());
	}

	@Test
	public void putReplaces() throws SpmlParseException {
		store.put("file:///a.spml", "<div>a</div>");
		StoredDocument second = store.put("file:///a.spml", "b");
		assertThat(store.get("file:///a.spml").get(), sameInstance(second));
		assertThat(store.uris(), is(Collections.singletonList("file:///a.spml")));
	}

	@Test
	public void remove() throws SpmlParseException {
		StoredDocument stored = store.put("file:///a.spml", "a");
		assertThat(store.remove("file:///a.spml").get(), sameInstance(stored));
		assertFalse(store.remove("file:///a.spml").isPresent());
		assertTrue(store.uris().isEmpty());
	}

	@Test
	public void versionsIncrease() throws SpmlParseException {
		StoredDocument first = store.put("file:///a.spml", "a");
		StoredDocument second = store.put("file:///b.spml", "b");
		assertTrue(second.getVersion() > first.getVersion());
	}

	@Test
	public void lateUpdateDoesNotReplaceNewerOne() throws SpmlParseException {
		StoredDocument older = store.put("file:///a.spml", "old");
		StoredDocument newer = store.put("file:///a.spml", "new");
		// the older update finishing last
		StoredDocument result = store.store("file:///a.spml", older);
		assertThat(result, sameInstance(newer));
		assertThat(store.get("file:///a.spml").get().getText(), is("new"));
	}
}

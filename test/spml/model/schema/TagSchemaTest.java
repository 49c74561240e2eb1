package spml.model.schema;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

public class TagSchemaTest {
	private static TagSchema schema;

	@BeforeClass
	public static void load() throws IOException {
		schema = TagSchema.load();
	}

	@Test
	public void bundledSchemaDefinesAllTags() {
		assertThat(schema.size(), is(81));
	}

	@Test
	public void barcodeAttributes() {
		TagDefinition barcode = schema.byName("sp:barcode").get();
		assertThat(barcode.getKind(), is("barcode_tag"));
		assertThat(barcode.getAttribute("name").get().getType(), is(TagAttributeType.IDENTIFIER));
		assertThat(barcode.getAttribute("height").get().getType(), is(TagAttributeType.EXPRESSION));
		assertThat(barcode.getAttribute("scope").get().getType(), is(TagAttributeType.STRING));
		assertFalse(barcode.getAttribute("nope").isPresent());
		assertThat(barcode.getRules().get(0), is(new AttributeRule("Required",
				Arrays.asList(AttributeRule.Argument.single("name")))));
	}

	@Test
	public void lookupByKind() {
		assertThat(schema.byKind("if_tag").get().getName(), is("sp:if"));
		assertThat(schema.byKind("spt_counter_tag").get().getName(), is("spt:counter"));
		assertFalse(schema.byKind("html_tag").isPresent());
	}

	@Test
	public void kindOf() {
		assertThat(TagDefinition.kindOf("sp:if"), is("if_tag"));
		assertThat(TagDefinition.kindOf("sp:checkbox"), is("checkbox_tag"));
		assertThat(TagDefinition.kindOf("spt:counter"), is("spt_counter_tag"));
	}

	@Test
	public void children() {
		assertThat(schema.byName("spt:counter").get().getChildren(), is(TagChildren.none()));
		assertThat(schema.byName("sp:condition").get().getChildren(),
				is(TagChildren.vector(Arrays.asList("sp:if", "sp:else", "sp:elseif"))));
	}

	@Test
	public void attributeTypesPickGrammars() {
		assertThat(TagAttributeType.STRING.getGrammar(), is(spml.model.spel.SpelGrammar.WORD));
		assertThat(TagAttributeType.CONDITION.getGrammar(), is(spml.model.spel.SpelGrammar.CONDITION));
	}

	@Test(expected = IOException.class)
	public void invalidSchemaIsRejected() throws IOException {
		TagSchema.parse("{\"tags\": [{\"name\": \"sp:x\", \"attributes\": [{\"name\": \"a\", \"type\": \"NOPE\"}]}]}");
	}

	@Test
	public void minimalDefinition() throws IOException {
		TagSchema parsed = TagSchema.parse("{\"tags\": [{\"name\": \"sp:x\"}]}");
		TagDefinition x = parsed.byName("sp:x").get();
		assertThat(x.getChildren(), is(TagChildren.any()));
		assertTrue(x.getAttributes().isEmpty());
		assertFalse(x.isDeprecated());
	}
}

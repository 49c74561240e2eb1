package spml.model.schema;

import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The read-only table of all known SPML tags. One instance is loaded up front and handed to every component that
 * needs it.
 */
public class TagSchema {
	public static final String RESOURCE = "/spml/tags.json";

	private static final Logger logger = Logger.getLogger(TagSchema.class.getName());

	private final Map<String, TagDefinition> byName;
	private final Map<String, TagDefinition> byKind;

	public TagSchema(Collection<TagDefinition> definitions) {
		Map<String, TagDefinition> byName = new LinkedHashMap<>();
		Map<String, TagDefinition> byKind = new LinkedHashMap<>();
		for (TagDefinition definition : definitions) {
			byName.put(definition.getName(), definition);
			byKind.put(definition.getKind(), definition);
		}
		this.byName = Collections.unmodifiableMap(byName);
		this.byKind = Collections.unmodifiableMap(byKind);
	}

	/**
	 * Loads the tag definitions bundled with this library.
	 */
	public static TagSchema load() throws IOException {
		try (InputStream in = TagSchema.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				throw new IOException("tag schema resource " + RESOURCE + " not found");
			}
			TagSchema schema = parse(IOUtils.toString(in, StandardCharsets.UTF_8));
			logger.fine("loaded " + schema.size() + " tag definitions");
			return schema;
		}
	}

	public static TagSchema parse(String json) throws IOException {
		try {
			JSONArray tags = new JSONObject(json).getJSONArray("tags");
			List<TagDefinition> definitions = new ArrayList<>();
			for (int i = 0; i < tags.length(); i++) {
				definitions.add(parseDefinition(tags.getJSONObject(i)));
			}
			return new TagSchema(definitions);
		} catch (JSONException e) {
			throw new IOException("tag schema is invalid: " + e.getMessage(), e);
		}
	}

	private static TagDefinition parseDefinition(JSONObject tag) {
		String name = tag.getString("name");
		boolean deprecated = tag.optBoolean("deprecated", false);

		TagChildren children = TagChildren.any();
		if (tag.has("children")) {
			JSONObject config = tag.getJSONObject("children");
			String type = config.getString("type");
			switch (type) {
				case "any":
					children = TagChildren.any();
					break;
				case "none":
					children = TagChildren.none();
					break;
				case "scalar":
					children = TagChildren.scalar(config.getJSONArray("tags").getString(0));
					break;
				case "vector":
					children = TagChildren.vector(strings(config.getJSONArray("tags")));
					break;
				default:
					throw new JSONException("unknown children type \"" + type + "\" of tag " + name);
			}
		}

		List<TagAttributeDefinition> attributes = new ArrayList<>();
		JSONArray attributeConfigs = tag.optJSONArray("attributes");
		if (attributeConfigs != null) {
			for (int i = 0; i < attributeConfigs.length(); i++) {
				JSONObject attribute = attributeConfigs.getJSONObject(i);
				TagAttributeType type;
				try {
					type = TagAttributeType.valueOf(attribute.getString("type"));
				} catch (IllegalArgumentException e) {
					throw new JSONException("unknown attribute type of " + name + "." + attribute.getString("name"), e);
				}
				attributes.add(new TagAttributeDefinition(
						attribute.getString("name"),
						type,
						attribute.has("moduleAttribute") ? attribute.getString("moduleAttribute") : null));
			}
		}

		List<AttributeRule> rules = new ArrayList<>();
		JSONArray ruleConfigs = tag.optJSONArray("rules");
		if (ruleConfigs != null) {
			for (int i = 0; i < ruleConfigs.length(); i++) {
				JSONObject rule = ruleConfigs.getJSONObject(i);
				JSONArray argumentConfigs = rule.getJSONArray("arguments");
				List<AttributeRule.Argument> arguments = new ArrayList<>();
				for (int j = 0; j < argumentConfigs.length(); j++) {
					Object argument = argumentConfigs.get(j);
					if (argument instanceof JSONArray) {
						arguments.add(AttributeRule.Argument.list(strings((JSONArray) argument)));
					} else {
						arguments.add(AttributeRule.Argument.single(argument.toString()));
					}
				}
				rules.add(new AttributeRule(rule.getString("rule"), arguments));
			}
		}
		return new TagDefinition(name, deprecated, children, attributes, rules);
	}

	private static List<String> strings(JSONArray array) {
		List<String> strings = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			strings.add(array.getString(i));
		}
		return strings;
	}

	public Optional<TagDefinition> byName(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	public Optional<TagDefinition> byKind(String kind) {
		return Optional.ofNullable(byKind.get(kind));
	}

	public Collection<TagDefinition> getDefinitions() {
		return byName.values();
	}

	public int size() {
		return byName.size();
	}
}

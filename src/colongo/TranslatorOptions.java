package colongo;

import org.json.JSONException;
import org.json.JSONObject;

// The reserved name prefixes used by a translation. Identifiers in the input must not start with
// either of them: the translator does not check this, and the output is undefined if they do.
//
// Both can be set in the JSON configuration file:
//
//   {"prefixes": {"declaration": "__decl_", "temporary": "__tmp_"}}
//
// Either field may be left out to keep its default.
public class TranslatorOptions {

	public static final String DEFAULT_DECLARATION_TAG = "__colongo_decl_";
	public static final String DEFAULT_TEMPORARY_TAG = "__colongo_tmp_";

	// fields of the JSON configuration file
	public static final String PREFIXES_FIELD = "prefixes";
	public static final String DECLARATION_FIELD = "declaration";
	public static final String TEMPORARY_FIELD = "temporary";

	private final String declarationTag;
	private final String temporaryTag;

	public TranslatorOptions(String declarationTag, String temporaryTag) throws ColonGoOptionException {
		checkTag(DECLARATION_FIELD, declarationTag);
		checkTag(TEMPORARY_FIELD, temporaryTag);
		if (declarationTag.startsWith(temporaryTag) || temporaryTag.startsWith(declarationTag)) {
			throw new ColonGoOptionException(
					"the declaration and temporary prefixes must not be prefixes of each other");
		}
		this.declarationTag = declarationTag;
		this.temporaryTag = temporaryTag;
	}

	public TranslatorOptions(JSONObject config) throws ColonGoOptionException {
		this(readTag(config, DECLARATION_FIELD, DEFAULT_DECLARATION_TAG),
				readTag(config, TEMPORARY_FIELD, DEFAULT_TEMPORARY_TAG));
	}

	public static TranslatorOptions defaults() {
		return new TranslatorOptions(DEFAULT_DECLARATION_TAG, DEFAULT_TEMPORARY_TAG);
	}

	private static String readTag(JSONObject config, String field, String defaultTag) throws ColonGoOptionException {
		if (!config.has(PREFIXES_FIELD)) {
			return defaultTag;
		}
		try {
			JSONObject prefixes = config.getJSONObject(PREFIXES_FIELD);
			if (!prefixes.has(field)) {
				return defaultTag;
			}
			return prefixes.getString(field);
		} catch (JSONException e) {
			throw new ColonGoOptionException(PREFIXES_FIELD + ": " + e.getMessage());
		}
	}

	// a tag starts every name made from it, so it has to be a valid start of a Go identifier
	private static void checkTag(String field, String tag) throws ColonGoOptionException {
		if (tag.isEmpty()) {
			throw new ColonGoOptionException("the " + field + " prefix must not be empty");
		}
		if (!Character.isLetter(tag.codePointAt(0)) && tag.charAt(0) != '_') {
			throw new ColonGoOptionException("the " + field + " prefix must start with a letter or '_': " + tag);
		}
		for (int i = 0; i < tag.length(); i = tag.offsetByCodePoints(i, 1)) {
			int c = tag.codePointAt(i);
			if (!Character.isLetterOrDigit(c) && c != '_') {
				throw new ColonGoOptionException(
						"the " + field + " prefix may only contain letters, digits and '_': " + tag);
			}
		}
	}

	public String getDeclarationTag() {
		return declarationTag;
	}

	public String getTemporaryTag() {
		return temporaryTag;
	}

}

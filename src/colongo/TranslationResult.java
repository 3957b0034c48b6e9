package colongo;

import colongo.errors.Issue;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of translating one input. Either both outputs are present and there are no
 * issues, or there are issues and neither output is.
 */
public class TranslationResult {

	private final byte[] formatted;
	private final byte[] translated;
	private final List<Issue> issues;

	private TranslationResult(byte[] formatted, byte[] translated, List<Issue> issues) {
		this.formatted = formatted;
		this.translated = translated;
		this.issues = Collections.unmodifiableList(issues);
	}

	public static TranslationResult success(byte[] formatted, byte[] translated) {
		return new TranslationResult(formatted, translated, Collections.emptyList());
	}

	public static TranslationResult failure(List<Issue> issues) {
		return new TranslationResult(null, null, issues);
	}

	public boolean isSuccessful() {
		return issues.isEmpty();
	}

	/**
	 * @return the input as canonically formatted Go, markers included, or null on failure
	 */
	public byte[] getFormatted() {
		return formatted;
	}

	/**
	 * @return the translated program, or null on failure
	 */
	public byte[] getTranslated() {
		return translated;
	}

	/**
	 * @return the issues found, ordered by location
	 */
	public List<Issue> getIssues() {
		return issues;
	}

}

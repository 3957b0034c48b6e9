package colongo.trans;

import colongo.ColonGoException;

/**
 * Exception raised while translating a unit of marked Go source
 *
 */
public class TranslationException extends ColonGoException {

	private static final long serialVersionUID = -3904417820349165108L;
	private static final String prefix = "Translation Error";

	public TranslationException(String msg) {
		super(prefix, msg);
	}

}

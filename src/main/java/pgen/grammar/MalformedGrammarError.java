package pgen.grammar;

import pgen.PGenException;

/**
 * Thrown if a grammar violates a structural invariant (e.g. a start symbol without productions or
 * a name that is used as a terminal and as a non terminal). No analysis is possible for such a grammar.
 */
public class MalformedGrammarError extends PGenException {

	public MalformedGrammarError(String message) {
		super(message);
	}

	public MalformedGrammarError(String format, Object... args) {
		super(String.format(format, args));
	}
}

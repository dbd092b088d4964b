package pgen.grammar;

/**
 * A terminal symbol
 */
public final class Terminal extends Symbol {

	/**
	 * Marker for the empty string, only used in FIRST sets
	 */
	public static final Terminal EPSILON = new Terminal("ε");

	/**
	 * End of input marker
	 */
	public static final Terminal EOF = new Terminal("$");

	public Terminal(String name) {
		super(name);
	}

	public boolean isEpsilon(){
		return this.equals(EPSILON);
	}

	public boolean isEOF(){
		return this.equals(EOF);
	}
}

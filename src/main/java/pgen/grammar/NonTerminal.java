package pgen.grammar;

/**
 * A non terminal symbol, its productions are stored in the grammar.
 */
public final class NonTerminal extends Symbol {

	public NonTerminal(String name) {
		super(name);
	}
}

package pgen.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Allows the simple creation of grammars from symbol names.
 *
 * Every name that appears on the left hand side of a production is a non terminal, every other name is
 * a terminal. The empty string and <code>ε</code> stand for the empty string and are dropped from right
 * hand sides.
 */
public class GrammarBuilder {

	private final List<Object[]> productions = new ArrayList<>();
	private final Set<String> declaredNonTerminals = new LinkedHashSet<>();
	private final Set<String> declaredTerminals = new LinkedHashSet<>();

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right names of the right hand side symbols, no names or "" or "ε" for an epsilon production
	 * @return self
	 */
	public GrammarBuilder add(String left, String... right){
		if (left == null || left.trim().isEmpty()){
			throw new MalformedGrammarError("The left hand side of a production can't be empty");
		}
		List<Object> prod = new ArrayList<>(right.length + 1);
		prod.add(left.trim());
		for (String name : right){
			if (name == null){
				throw new MalformedGrammarError("Production for %s contains a null symbol", left);
			}
			name = name.trim();
			if (!name.isEmpty() && !name.equals(Terminal.EPSILON.name)){
				prod.add(name);
			}
		}
		productions.add(prod.toArray());
		return this;
	}

	/**
	 * Adds a production for each alternative.
	 *
	 * @param left name of the defining non terminal
	 * @param alternatives right hand sides, each one is split at white space
	 * @return self
	 */
	public GrammarBuilder addAlternatives(String left, String... alternatives){
		for (String alternative : alternatives){
			add(left, alternative.trim().split("\\s+"));
		}
		return this;
	}

	/**
	 * Declares the non terminals of the grammar. If non terminals are declared, every left hand side
	 * has to be declared and every declared non terminal needs a production.
	 */
	public GrammarBuilder declareNonTerminals(String... names){
		declaredNonTerminals.addAll(Arrays.asList(names));
		return this;
	}

	/**
	 * Declares terminals, a declared terminal can't be used as a left hand side.
	 */
	public GrammarBuilder declareTerminals(String... names){
		declaredTerminals.addAll(Arrays.asList(names));
		return this;
	}

	/**
	 * Creates the grammar.
	 *
	 * @param startNonTerminal name of the start non terminal
	 * @throws MalformedGrammarError if the productions and declarations don't form a valid grammar
	 */
	public Grammar toGrammar(String startNonTerminal) {
		if (startNonTerminal == null || startNonTerminal.isEmpty()){
			throw new MalformedGrammarError("No start symbol given");
		}
		Set<String> lefts = new LinkedHashSet<>();
		for (Object[] prod : productions){
			lefts.add((String)prod[0]);
		}
		for (String left : lefts){
			if (declaredTerminals.contains(left)){
				throw new MalformedGrammarError("Ambiguity while building the grammar: '%s' is declared as " +
						"a terminal and therefore can't be used as the left hand side of a production", left);
			}
			if (!declaredNonTerminals.isEmpty() && !declaredNonTerminals.contains(left)){
				throw new MalformedGrammarError("The left hand side '%s' is not declared as a non terminal", left);
			}
		}
		for (String nonTerminal : declaredNonTerminals){
			if (declaredTerminals.contains(nonTerminal)){
				throw new MalformedGrammarError("'%s' is declared as a terminal and as a non terminal", nonTerminal);
			}
			if (!lefts.contains(nonTerminal)){
				throw new MalformedGrammarError("The declared non terminal '%s' has no productions", nonTerminal);
			}
		}
		if (!lefts.contains(startNonTerminal)){
			throw new MalformedGrammarError("Start symbol '%s' has no productions", startNonTerminal);
		}
		List<Production> productions = new ArrayList<>();
		for (Object[] prod : this.productions) {
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++) {
				String name = (String)prod[i];
				right.add(lefts.contains(name) ? new NonTerminal(name) : new Terminal(name));
			}
			productions.add(new Production(productions.size(), new NonTerminal((String)prod[0]), right));
		}
		return new Grammar(productions, new NonTerminal(startNonTerminal));
	}
}

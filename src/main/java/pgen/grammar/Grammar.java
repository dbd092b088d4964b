package pgen.grammar;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;

import pgen.Config;
import pgen.util.Pair;

import static pgen.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * A grammar is immutable. Non terminals are ordered by their first definition, terminals by their first use.
 * Use the {@link GrammarBuilder} to build a grammar instance from symbol names.
 *
 * @see GrammarBuilder GrammarBuilder
 */
public class Grammar {

	private final ImmutableList<Production> productions;

	private final NonTerminal start;

	private final ImmutableSet<NonTerminal> nonTerminals;

	private final ImmutableSet<Terminal> terminals;

	private final ImmutableListMultimap<NonTerminal, Production> productionsPerNonTerminal;

	/**
	 * Create a new Grammar object and check its invariants.
	 *
	 * @param productions productions, the id of each production has to be equal to its index
	 * @param start start non terminal
	 * @throws MalformedGrammarError if the start symbol has no productions, a name is used for
	 *                               a terminal and a non terminal, a used non terminal has no productions
	 *                               or a reserved symbol is misused
	 */
	public Grammar(List<Production> productions, NonTerminal start) {
		if (start == null){
			throw new MalformedGrammarError("No start symbol given");
		}
		this.productions = ImmutableList.copyOf(productions);
		this.start = start;
		Map<String, NonTerminal> nonTerminalsPerName = new LinkedHashMap<>();
		ImmutableListMultimap.Builder<NonTerminal, Production> perNonTerminal = ImmutableListMultimap.builder();
		for (int i = 0; i < this.productions.size(); i++){
			Production production = this.productions.get(i);
			if (production.id != i){
				throw new MalformedGrammarError("Production %s has the id %d but is at position %d",
						production.format(), production.id, i);
			}
			checkNotReserved(production.left);
			nonTerminalsPerName.putIfAbsent(production.left.name, production.left);
			perNonTerminal.put(production.left, production);
		}
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (Production production : this.productions){
			for (Symbol symbol : production.right){
				if (symbol instanceof Terminal){
					Terminal terminal = (Terminal)symbol;
					checkNotReserved(terminal);
					if (nonTerminalsPerName.containsKey(terminal.name)){
						throw new MalformedGrammarError("'%s' is used as a terminal in production %s but is also " +
								"the left hand side of a production", terminal, production);
					}
					terminals.add(terminal);
				} else if (!nonTerminalsPerName.containsKey(symbol.name)){
					throw new MalformedGrammarError("Non terminal '%s' used in production %s has no productions",
							symbol, production);
				}
			}
		}
		if (!nonTerminalsPerName.containsKey(start.name)){
			throw new MalformedGrammarError("Start symbol '%s' has no productions", start);
		}
		this.nonTerminals = ImmutableSet.copyOf(nonTerminalsPerName.values());
		this.terminals = ImmutableSet.copyOf(terminals);
		this.productionsPerNonTerminal = perNonTerminal.build();
	}

	private static void checkNotReserved(Symbol symbol){
		if (symbol.name.equals(Terminal.EOF.name)){
			throw new MalformedGrammarError("'%s' is reserved for the end of input", symbol);
		}
		if (symbol instanceof NonTerminal && symbol.name.equals(Terminal.EPSILON.name)){
			throw new MalformedGrammarError("'%s' is reserved for the empty string and can't be a non terminal",
					symbol);
		}
		if (symbol.name.isEmpty()){
			throw new MalformedGrammarError("Symbol names can't be empty");
		}
	}

	/**
	 * Create a grammar from (left hand side name, right hand side names) pairs.
	 * Every left hand side is a non terminal, every other name is a terminal.
	 *
	 * @param rules productions in declaration order
	 * @param start name of the start non terminal
	 * @return new grammar
	 */
	public static Grammar fromRules(List<Pair<String, List<String>>> rules, String start){
		GrammarBuilder builder = new GrammarBuilder();
		for (Pair<String, List<String>> rule : rules){
			builder.add(rule.first, rule.second.toArray(new String[0]));
		}
		return builder.toGrammar(start);
	}

	/**
	 * Create the augmented grammar with a new start non terminal <pre>S'</pre> and a single new production
	 * <pre>S' → S</pre> (assuming <pre>S</pre> is the current start non terminal). The new production is the
	 * last production.
	 *
	 * @return new grammar
	 */
	public Grammar augment(){
		return augment(Config.augmentedSuffix());
	}

	/**
	 * @param suffix appended to the start symbol name until the name is unused
	 */
	Grammar augment(String suffix){
		Preconditions.checkArgument(!suffix.isEmpty(), "The suffix of the augmented start symbol is empty");
		Set<String> names = new LinkedHashSet<>();
		for (Symbol symbol : getSymbols()){
			names.add(symbol.name);
		}
		String startName = start.name + suffix;
		while (names.contains(startName)){
			startName += suffix;
		}
		NonTerminal newStart = new NonTerminal(startName);
		ImmutableList<Production> newProductions = ImmutableList.<Production>builder()
				.addAll(productions)
				.add(new Production(productions.size(), newStart, ImmutableList.of(start)))
				.build();
		return new Grammar(newProductions, newStart);
	}

	/**
	 * Non terminals that aren't reachable from the start non terminal.
	 */
	public Set<NonTerminal> getUnreachable(){
		Set<NonTerminal> reached = new LinkedHashSet<>();
		Deque<NonTerminal> depthFirstStack = new ArrayDeque<>();
		depthFirstStack.push(start);
		reached.add(start);
		while (!depthFirstStack.isEmpty()){
			NonTerminal t = depthFirstStack.pop();
			for (Production prod : getProductionsOf(t)){
				for (NonTerminal nonTerminal : prod.nonTerminals){
					if (reached.add(nonTerminal)){
						depthFirstStack.push(nonTerminal);
					}
				}
			}
		}
		Set<NonTerminal> unreachable = new LinkedHashSet<>(nonTerminals);
		unreachable.removeAll(reached);
		return unreachable;
	}

	public ImmutableList<Production> getProductions(){
		return productions;
	}

	public ImmutableList<Production> getProductionsOf(NonTerminal nonTerminal){
		return productionsPerNonTerminal.get(nonTerminal);
	}

	public Production getProductionForId(int id){
		return productions.get(id);
	}

	public NonTerminal getStart(){
		return start;
	}

	public ImmutableSet<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	/**
	 * Terminals used in the productions, without the end of input marker
	 */
	public ImmutableSet<Terminal> getTerminals(){
		return terminals;
	}

	/**
	 * symbols = non terminals ∪ terminals (without epsilon and end of input)
	 */
	public ImmutableSet<Symbol> getSymbols(){
		return ImmutableSet.<Symbol>builder().addAll(nonTerminals).addAll(terminals).build();
	}

	public NonTerminal getNonTerminal(String name){
		NonTerminal nonTerminal = new NonTerminal(name);
		if (!nonTerminals.contains(nonTerminal)){
			throw new IllegalArgumentException("No such non terminal " + name);
		}
		return nonTerminal;
	}

	public Terminal getTerminal(String name){
		Terminal terminal = new Terminal(name);
		if (!terminals.contains(terminal) && !terminal.isEOF()){
			throw new IllegalArgumentException("No such terminal " + name);
		}
		return terminal;
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}

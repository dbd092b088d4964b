package pgen.grammar;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import pgen.Config;

import static pgen.util.Utils.formatSet;

/**
 * FIRST(1) sets of all symbols of a grammar.
 *
 * FIRST(X) contains the terminals that can begin a string derived from X and {@link Terminal#EPSILON}
 * if X can derive the empty string.
 */
public final class FirstSets {

	private static final Logger LOG = Config.logger(FirstSets.class);

	private final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets;

	private final int passes;

	private FirstSets(Grammar grammar, ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets, int passes) {
		this.grammar = grammar;
		this.sets = sets;
		this.passes = passes;
	}

	public static FirstSets calculate(Grammar grammar){
		return calculate(grammar, pass -> {});
	}

	/**
	 * Calculate the first sets by iterating over all productions until a full pass changes nothing.
	 *
	 * For each production A → X1 … Xn: add FIRST(Xi) \ {ε} to FIRST(A) while all X1 … X(i-1) contain ε
	 * in their first set, add ε if all Xi contain it (or n = 0).
	 *
	 * @param grammar analysed grammar
	 * @param passListener gets a snapshot of the first sets of all non terminals after each pass
	 * @return first sets
	 */
	public static FirstSets calculate(Grammar grammar,
	                                  Consumer<ImmutableMap<NonTerminal, ImmutableSet<Terminal>>> passListener){
		Map<NonTerminal, Set<Terminal>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		int passes = 0;
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Production production : grammar.getProductions()){
				Set<Terminal> set = first.get(production.left);
				boolean allEpsilonable = true;
				for (Symbol symbol : production.right){
					if (symbol instanceof Terminal){
						firstChanged |= set.add((Terminal)symbol);
						allEpsilonable = false;
						break;
					}
					Set<Terminal> symbolFirst = first.get(symbol);
					for (Terminal terminal : symbolFirst){
						if (!terminal.isEpsilon()){
							firstChanged |= set.add(terminal);
						}
					}
					if (!symbolFirst.contains(Terminal.EPSILON)){
						allEpsilonable = false;
						break;
					}
				}
				if (allEpsilonable){
					firstChanged |= set.add(Terminal.EPSILON);
				}
			}
			passes++;
			passListener.accept(freeze(first));
		} while (firstChanged);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("First sets of %d non terminals stable after %d passes",
					first.size(), passes));
		}
		return new FirstSets(grammar, freeze(first), passes);
	}

	static <K> ImmutableMap<K, ImmutableSet<Terminal>> freeze(Map<K, Set<Terminal>> map){
		ImmutableMap.Builder<K, ImmutableSet<Terminal>> builder = ImmutableMap.builder();
		for (Map.Entry<K, Set<Terminal>> entry : map.entrySet()){
			builder.put(entry.getKey(), ImmutableSet.copyOf(entry.getValue()));
		}
		return builder.build();
	}

	/**
	 * FIRST(symbol), {terminal} for a terminal, {ε} for epsilon
	 */
	public ImmutableSet<Terminal> of(Symbol symbol){
		if (symbol instanceof Terminal){
			return ImmutableSet.of((Terminal)symbol);
		}
		ImmutableSet<Terminal> set = sets.get(symbol);
		if (set == null){
			throw new IllegalArgumentException("Unknown non terminal " + symbol);
		}
		return set;
	}

	/**
	 * First set of a sequence of symbols, {ε} for the empty sequence.
	 */
	public ImmutableSet<Terminal> ofTerm(List<? extends Symbol> term){
		Set<Terminal> set = new LinkedHashSet<>();
		for (Symbol symbol : term){
			ImmutableSet<Terminal> symbolFirst = of(symbol);
			for (Terminal terminal : symbolFirst){
				if (!terminal.isEpsilon()){
					set.add(terminal);
				}
			}
			if (!symbolFirst.contains(Terminal.EPSILON)){
				return ImmutableSet.copyOf(set);
			}
		}
		set.add(Terminal.EPSILON);
		return ImmutableSet.copyOf(set);
	}

	/**
	 * Can the symbol be derived to the empty string?
	 */
	public boolean isEpsilonable(Symbol symbol){
		return of(symbol).contains(Terminal.EPSILON);
	}

	/**
	 * Can the term be derived to the empty string?
	 */
	public boolean isEpsilonable(List<? extends Symbol> term){
		for (Symbol symbol : term){
			if (!isEpsilonable(symbol)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Non terminals that can be derived to the empty string
	 */
	public ImmutableSet<NonTerminal> getEpsilonable(){
		ImmutableSet.Builder<NonTerminal> builder = ImmutableSet.builder();
		for (Map.Entry<NonTerminal, ImmutableSet<Terminal>> entry : sets.entrySet()){
			if (entry.getValue().contains(Terminal.EPSILON)){
				builder.add(entry.getKey());
			}
		}
		return builder.build();
	}

	public ImmutableMap<NonTerminal, ImmutableSet<Terminal>> asMap(){
		return sets;
	}

	public Grammar getGrammar(){
		return grammar;
	}

	/**
	 * Number of passes over all productions until the sets were stable (including the final pass
	 * without changes)
	 */
	public int getPasses(){
		return passes;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, ImmutableSet<Terminal>> entry : sets.entrySet()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			builder.append("FIRST(").append(entry.getKey()).append(") = ")
					.append(formatSet(entry.getValue()));
		}
		return builder.toString();
	}
}

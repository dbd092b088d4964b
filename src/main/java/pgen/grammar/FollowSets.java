package pgen.grammar;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import pgen.Config;

import static pgen.util.Utils.formatSet;

/**
 * FOLLOW(1) sets of all non terminals of a grammar.
 *
 * FOLLOW(A) contains the terminals (and {@link Terminal#EOF}) that can directly follow A in a sentential
 * form derived from the start symbol.
 */
public final class FollowSets {

	private static final Logger LOG = Config.logger(FollowSets.class);

	private final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets;

	private final int passes;

	private FollowSets(Grammar grammar, ImmutableMap<NonTerminal, ImmutableSet<Terminal>> sets, int passes) {
		this.grammar = grammar;
		this.sets = sets;
		this.passes = passes;
	}

	public static FollowSets calculate(Grammar grammar, FirstSets first){
		return calculate(grammar, first, pass -> {});
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in FOLLOW(S) (S is the start symbol).
	 * If there is a production A → aBb, (where a can be a whole string) then everything in FIRST(b) except
	 * for ε is placed in FOLLOW(B).
	 * If there is a production A → aB, or a production A → aBb where FIRST(b) contains ε, then everything
	 * in FOLLOW(A) is in FOLLOW(B).
	 * Repeat until a full pass over all productions doesn't change anything.
	 *
	 * @param grammar analysed grammar
	 * @param first stable first sets of the grammar
	 * @param passListener gets a snapshot of the follow sets after each pass
	 * @return follow sets
	 */
	public static FollowSets calculate(Grammar grammar, FirstSets first,
	                                   Consumer<ImmutableMap<NonTerminal, ImmutableSet<Terminal>>> passListener){
		Preconditions.checkArgument(first.getGrammar() == grammar,
				"The first sets were calculated for another grammar");
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(grammar.getStart()).add(Terminal.EOF);
		int passes = 0;
		boolean followChanged;
		do {
			followChanged = false;
			for (Production production : grammar.getProductions()){
				List<Symbol> right = production.right;
				for (int i = 0; i < right.size(); i++){
					if (!(right.get(i) instanceof NonTerminal)){
						continue;
					}
					Set<Terminal> set = follow.get(right.get(i));
					ImmutableSet<Terminal> restFirst = first.ofTerm(right.subList(i + 1, right.size()));
					for (Terminal terminal : restFirst){
						if (!terminal.isEpsilon()){
							followChanged |= set.add(terminal);
						}
					}
					if (restFirst.contains(Terminal.EPSILON)){
						followChanged |= set.addAll(follow.get(production.left));
					}
				}
			}
			passes++;
			passListener.accept(FirstSets.freeze(follow));
		} while (followChanged);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Follow sets of %d non terminals stable after %d passes",
					follow.size(), passes));
		}
		return new FollowSets(grammar, FirstSets.freeze(follow), passes);
	}

	public ImmutableSet<Terminal> of(NonTerminal nonTerminal){
		ImmutableSet<Terminal> set = sets.get(nonTerminal);
		if (set == null){
			throw new IllegalArgumentException("Unknown non terminal " + nonTerminal);
		}
		return set;
	}

	public ImmutableMap<NonTerminal, ImmutableSet<Terminal>> asMap(){
		return sets;
	}

	public Grammar getGrammar(){
		return grammar;
	}

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
			builder.append("FOLLOW(").append(entry.getKey()).append(") = ")
					.append(formatSet(entry.getValue()));
		}
		return builder.toString();
	}
}

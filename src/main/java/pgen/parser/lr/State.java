package pgen.parser.lr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Symbol;

/**
 * A state of the LR(0) automaton: a closed set of LR(0) items.
 *
 * States are equal if their item sets are equal, the id is only the position in the canonical collection.
 */
public final class State {

	public final int id;

	private final ImmutableSortedSet<Situation> kernel;

	private final ImmutableSortedSet<Situation> situations;

	State(int id, ImmutableSortedSet<Situation> kernel, ImmutableSortedSet<Situation> situations) {
		this.id = id;
		this.kernel = kernel;
		this.situations = situations;
	}

	/**
	 * Closure of an item set: for every item [A → α · B β] with a non terminal B add [B → · γ] for every
	 * production B → γ, until nothing is added.
	 *
	 * @param grammar grammar the items belong to
	 * @param items initial items
	 * @return closed item set
	 */
	public static ImmutableSortedSet<Situation> closure(Grammar grammar, Collection<Situation> items){
		List<Situation> situations = new ArrayList<>(new LinkedHashSet<>(items));
		Set<Situation> alreadyAdded = new HashSet<>(situations);
		for (int i = 0; i < situations.size(); i++){
			Situation situation = situations.get(i);
			if (situation.inFrontOfNonTerminal()){
				for (Production prod : grammar.getProductionsOf((NonTerminal)situation.nextSymbol())){
					Situation added = new Situation(prod);
					if (alreadyAdded.add(added)){
						situations.add(added);
					}
				}
			}
		}
		return ImmutableSortedSet.copyOf(situations);
	}

	/**
	 * Items of this state with the dot moved over the passed symbol (the kernel of the goto state).
	 *
	 * @return advanced items, empty if no item has the symbol after its dot
	 */
	public ImmutableSortedSet<Situation> advance(Symbol symbol){
		ImmutableSortedSet.Builder<Situation> builder = ImmutableSortedSet.naturalOrder();
		for (Situation situation : situations){
			if (situation.inFrontOf(symbol)){
				builder.add(situation.advance());
			}
		}
		return builder.build();
	}

	/**
	 * Goto(state, symbol): the closure of the advanced items.
	 *
	 * @return item set of the target state, empty if there is no transition for the symbol
	 */
	public ImmutableSortedSet<Situation> goTo(Grammar grammar, Symbol symbol){
		ImmutableSortedSet<Situation> advanced = advance(symbol);
		if (advanced.isEmpty()){
			return advanced;
		}
		return closure(grammar, advanced);
	}

	/**
	 * Symbols directly after a dot, in order of the items
	 */
	public ImmutableList<Symbol> nextSymbols(){
		Set<Symbol> symbols = new LinkedHashSet<>();
		for (Situation situation : situations){
			if (situation.canAdvance()){
				symbols.add(situation.nextSymbol());
			}
		}
		return ImmutableList.copyOf(symbols);
	}

	public boolean hasShiftableSituations(){
		for (Situation situation : situations){
			if (situation.canAdvance()){
				return true;
			}
		}
		return false;
	}

	public ImmutableSortedSet<Situation> getSituations(){
		return situations;
	}

	/**
	 * Items the state was created from (before the closure)
	 */
	public ImmutableSortedSet<Situation> getKernel(){
		return kernel;
	}

	public boolean contains(Situation situation){
		return situations.contains(situation);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof State && ((State)obj).situations.equals(situations);
	}

	@Override
	public int hashCode() {
		return situations.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Situation situation : situations){
			builder.append("\n- ").append(situation);
		}
		return "State " + id + builder;
	}
}

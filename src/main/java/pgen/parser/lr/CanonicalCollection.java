package pgen.parser.lr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.traverse.BreadthFirstIterator;

import pgen.Config;
import pgen.grammar.Grammar;
import pgen.grammar.Production;
import pgen.grammar.Symbol;

/**
 * The canonical collection of LR(0) item sets, i.e. the states of the LR(0) automaton and its
 * transition function.
 *
 * State 0 is the closure of the augmented start item <pre>[S' → · S]</pre>.
 */
public class CanonicalCollection {

	private static final Logger LOG = Config.logger(CanonicalCollection.class);

	/**
	 * An edge of the automaton
	 */
	public static final class Transition {

		public final int from;
		public final Symbol symbol;
		public final int to;

		Transition(int from, Symbol symbol, int to) {
			this.from = from;
			this.symbol = symbol;
			this.to = to;
		}

		@Override
		public String toString() {
			return from + " -" + symbol + "-> " + to;
		}
	}

	private final Grammar grammar;

	private final Grammar augmentedGrammar;

	private final Production augmentedProduction;

	private final ImmutableList<State> states;

	/**
	 * (state id, symbol) → state id
	 */
	private final ImmutableTable<Integer, Symbol, Integer> transitions;

	private CanonicalCollection(Grammar grammar, Grammar augmentedGrammar, Production augmentedProduction,
	                            ImmutableList<State> states, ImmutableTable<Integer, Symbol, Integer> transitions) {
		this.grammar = grammar;
		this.augmentedGrammar = augmentedGrammar;
		this.augmentedProduction = augmentedProduction;
		this.states = states;
		this.transitions = transitions;
	}

	/**
	 * Build the automaton with a work list: each state is visited once, for each symbol after a dot
	 * the goto state is created if no state with the same item set exists yet.
	 *
	 * The work list is a FIFO queue and the symbols are visited in item order, so the state numbering only
	 * depends on the grammar.
	 */
	public static CanonicalCollection createFromGrammar(Grammar grammar){
		Grammar augmented = grammar.augment();
		Production startProduction = augmented.getProductionsOf(augmented.getStart()).get(0);
		List<State> states = new ArrayList<>();
		Map<ImmutableSortedSet<Situation>, State> statePerSituations = new HashMap<>();
		ImmutableTable.Builder<Integer, Symbol, Integer> transitions = ImmutableTable.builder();
		ImmutableSortedSet<Situation> startKernel = ImmutableSortedSet.of(new Situation(startProduction));
		State startState = new State(0, startKernel, State.closure(augmented, startKernel));
		states.add(startState);
		statePerSituations.put(startState.getSituations(), startState);
		Queue<State> workList = new ArrayDeque<>();
		workList.add(startState);
		while (!workList.isEmpty()){
			State currentState = workList.poll();
			for (Symbol shiftSymbol : currentState.nextSymbols()){
				ImmutableSortedSet<Situation> kernel = currentState.advance(shiftSymbol);
				ImmutableSortedSet<Situation> situations = State.closure(augmented, kernel);
				State nextState = statePerSituations.get(situations);
				if (nextState == null){
					nextState = new State(states.size(), kernel, situations);
					states.add(nextState);
					statePerSituations.put(situations, nextState);
					workList.add(nextState);
				}
				transitions.put(currentState.id, shiftSymbol, nextState.id);
			}
		}
		CanonicalCollection collection = new CanonicalCollection(grammar, augmented, startProduction,
				ImmutableList.copyOf(states), transitions.build());
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("LR(0) automaton with %d states and %d transitions",
					states.size(), collection.transitions.size()));
		}
		List<State> unreachable = collection.getUnreachableStates();
		if (!unreachable.isEmpty()){
			LOG.severe("Unreachable states in the LR(0) automaton: " + unreachable);
		}
		return collection;
	}

	/**
	 * Target of the transition from the passed state with the passed symbol
	 *
	 * @return id of the target state or null if there is no such transition
	 */
	public Integer goTo(int state, Symbol symbol){
		return transitions.get(state, symbol);
	}

	/**
	 * Outgoing transitions of the passed state
	 */
	public ImmutableMap<Symbol, Integer> transitionsOf(int state){
		return transitions.row(state);
	}

	public ImmutableTable<Integer, Symbol, Integer> getTransitions(){
		return transitions;
	}

	public ImmutableList<State> getStates(){
		return states;
	}

	public State getState(int id){
		return states.get(id);
	}

	public State getStartState(){
		return states.get(0);
	}

	public int size(){
		return states.size();
	}

	/**
	 * Grammar the automaton is built for (not augmented)
	 */
	public Grammar getGrammar(){
		return grammar;
	}

	public Grammar getAugmentedGrammar(){
		return augmentedGrammar;
	}

	/**
	 * The production <pre>S' → S</pre>, it's not part of the original grammar
	 */
	public Production getAugmentedProduction(){
		return augmentedProduction;
	}

	/**
	 * Is the situation <pre>[S' → S ·]</pre>?
	 */
	public boolean isAccepting(Situation situation){
		return situation.atEnd() && situation.production.equals(augmentedProduction);
	}

	/**
	 * The automaton as a graph with state ids as vertices
	 */
	public Graph<Integer, Transition> toDirectedGraph(){
		Graph<Integer, Transition> graph = new DirectedPseudograph<>(Transition.class);
		for (State state : states){
			graph.addVertex(state.id);
		}
		for (Table.Cell<Integer, Symbol, Integer> cell : transitions.cellSet()){
			graph.addEdge(cell.getRowKey(), cell.getValue(),
					new Transition(cell.getRowKey(), cell.getColumnKey(), cell.getValue()));
		}
		return graph;
	}

	/**
	 * States that can't be reached from the start state via transitions
	 */
	public ImmutableList<State> getUnreachableStates(){
		Set<Integer> reached = new HashSet<>();
		BreadthFirstIterator<Integer, Transition> iterator =
				new BreadthFirstIterator<>(toDirectedGraph(), getStartState().id);
		while (iterator.hasNext()){
			reached.add(iterator.next());
		}
		ImmutableList.Builder<State> unreachable = ImmutableList.builder();
		for (State state : states){
			if (!reached.contains(state.id)){
				unreachable.add(state);
			}
		}
		return unreachable.build();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state);
			for (Map.Entry<Symbol, Integer> transition : transitionsOf(state.id).entrySet()){
				builder.append("\n  ").append(transition.getKey()).append(" → ").append(transition.getValue());
			}
		}
		return builder.toString();
	}
}

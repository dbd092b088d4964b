package pgen.parser.lr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;

import pgen.Config;
import pgen.grammar.FollowSets;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Symbol;
import pgen.grammar.Terminal;
import pgen.parser.Conflict;

/**
 * SLR(1) parser table, consisting of the ACTION and the GOTO table.
 *
 * An ACTION cell with more than one action is a conflict, the grammar is SLR(1) iff there are none.
 */
public class LRParserTable {

	private static final Logger LOG = Config.logger(LRParserTable.class);

	public abstract static class Action {

		@Override
		public int hashCode() {
			return toString().hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj != null && obj.getClass() == getClass() && obj.toString().equals(toString());
		}
	}

	public static final class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "shift(" + stateToBeShifted + ")";
		}
	}

	public static final class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		public int productionId(){
			return production.id;
		}

		@Override
		public String toString() {
			return "reduce(" + production.id + ")";
		}
	}

	public static final class Accept extends Action {

		public static final Accept INSTANCE = new Accept();

		private Accept(){}

		@Override
		public String toString() {
			return "accept()";
		}
	}

	public final Grammar grammar;

	/**
	 * (state id, terminal) → actions
	 */
	private final ImmutableTable<Integer, Terminal, ImmutableSet<Action>> actionTable;

	/**
	 * (state id, non terminal) → next state id
	 */
	private final ImmutableTable<Integer, NonTerminal, Integer> gotoTable;

	private final ImmutableList<Conflict<Integer, Action>> conflicts;

	private final int stateCount;

	private LRParserTable(Grammar grammar, ImmutableTable<Integer, Terminal, ImmutableSet<Action>> actionTable,
	                      ImmutableTable<Integer, NonTerminal, Integer> gotoTable,
	                      ImmutableList<Conflict<Integer, Action>> conflicts, int stateCount) {
		this.grammar = grammar;
		this.actionTable = actionTable;
		this.gotoTable = gotoTable;
		this.conflicts = conflicts;
		this.stateCount = stateCount;
	}

	/**
	 * Build the SLR(1) table from the LR(0) automaton.
	 *
	 * For each state: shift on the terminal after a dot, accept on $ for <pre>[S' → S ·]</pre>, reduce on
	 * every terminal in FOLLOW(A) for every other completed item <pre>[A → α ·]</pre>. The GOTO table
	 * contains the non terminal transitions. Conflicting actions are all kept and reported.
	 */
	public static LRParserTable fromCollection(Grammar grammar, CanonicalCollection collection, FollowSets follow){
		Preconditions.checkArgument(collection.getGrammar() == grammar,
				"The automaton was built for another grammar");
		Preconditions.checkArgument(follow.getGrammar() == grammar,
				"The follow sets were calculated for another grammar");
		List<Map<Terminal, Set<Action>>> actionRows = new ArrayList<>();
		ImmutableTable.Builder<Integer, NonTerminal, Integer> gotoTable = ImmutableTable.builder();
		for (State state : collection.getStates()){
			Map<Terminal, Set<Action>> row = new LinkedHashMap<>();
			actionRows.add(row);
			for (Situation situation : state.getSituations()){
				if (situation.inFrontOfTerminal()){
					Terminal terminal = (Terminal)situation.nextSymbol();
					insert(row, terminal, new ShiftAction(collection.goTo(state.id, terminal)));
				} else if (collection.isAccepting(situation)){
					insert(row, Terminal.EOF, Accept.INSTANCE);
				} else if (situation.atEnd()){
					for (Terminal terminal : follow.of(situation.production.left)){
						insert(row, terminal, new ReduceAction(situation.production));
					}
				}
			}
			for (Map.Entry<Symbol, Integer> transition : collection.transitionsOf(state.id).entrySet()){
				if (transition.getKey() instanceof NonTerminal){
					gotoTable.put(state.id, (NonTerminal)transition.getKey(), transition.getValue());
				}
			}
		}
		ImmutableTable.Builder<Integer, Terminal, ImmutableSet<Action>> actionTable = ImmutableTable.builder();
		List<Conflict<Integer, Action>> conflicts = new ArrayList<>();
		for (int state = 0; state < actionRows.size(); state++){
			for (Map.Entry<Terminal, Set<Action>> cell : actionRows.get(state).entrySet()){
				actionTable.put(state, cell.getKey(), ImmutableSet.copyOf(cell.getValue()));
				if (cell.getValue().size() > 1){
					Conflict<Integer, Action> conflict = new Conflict<>(classify(cell.getValue()), state,
							cell.getKey(), cell.getValue());
					if (Config.logConflicts()){
						LOG.warning(conflict.toString());
					}
					conflicts.add(conflict);
				}
			}
		}
		return new LRParserTable(grammar, actionTable.build(), gotoTable.build(), ImmutableList.copyOf(conflicts),
				collection.size());
	}

	private static void insert(Map<Terminal, Set<Action>> row, Terminal terminal, Action action){
		row.computeIfAbsent(terminal, t -> new LinkedHashSet<>()).add(action);
	}

	/**
	 * Kind of a conflict between the passed actions: shift and reduce, otherwise several reduces, otherwise
	 * accept and reduce.
	 */
	static Conflict.Kind classify(Collection<Action> actions){
		int shifts = 0;
		int reduces = 0;
		for (Action action : actions){
			if (action instanceof ShiftAction){
				shifts++;
			} else if (action instanceof ReduceAction){
				reduces++;
			}
		}
		if (shifts > 0 && reduces > 0){
			return Conflict.Kind.SHIFT_REDUCE;
		}
		if (reduces > 1){
			return Conflict.Kind.REDUCE_REDUCE;
		}
		return Conflict.Kind.ACCEPT_REDUCE;
	}

	/**
	 * Actions for the passed state and lookahead, empty for an error cell
	 */
	public ImmutableSet<Action> getActions(int state, Terminal terminal){
		ImmutableSet<Action> actions = actionTable.get(state, terminal);
		return actions == null ? ImmutableSet.of() : actions;
	}

	/**
	 * The single action of the passed cell or null if the cell is empty or conflicting
	 */
	public Action getAction(int state, Terminal terminal){
		ImmutableSet<Action> actions = getActions(state, terminal);
		return actions.size() == 1 ? actions.iterator().next() : null;
	}

	/**
	 * @return next state or null if there is no such entry
	 */
	public Integer getGoto(int state, NonTerminal nonTerminal){
		return gotoTable.get(state, nonTerminal);
	}

	public ImmutableMap<Terminal, ImmutableSet<Action>> getActionRow(int state){
		return actionTable.row(state);
	}

	public ImmutableTable<Integer, Terminal, ImmutableSet<Action>> getActionTable(){
		return actionTable;
	}

	public ImmutableTable<Integer, NonTerminal, Integer> getGotoTable(){
		return gotoTable;
	}

	public ImmutableList<Conflict<Integer, Action>> getConflicts(){
		return conflicts;
	}

	public boolean isSLR1(){
		return conflicts.isEmpty();
	}

	public int getStateCount(){
		return stateCount;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < stateCount; i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(String.format("State = %5d: ", i));
			builder.append(" Actions = ");
			builder.append(actionTable.row(i));
			builder.append(" GOTO = ");
			builder.append(gotoTable.row(i));
		}
		return builder.toString();
	}
}

package pgen.parser.ll;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;

import pgen.Config;
import pgen.grammar.FirstSets;
import pgen.grammar.FollowSets;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Terminal;
import pgen.parser.Conflict;

/**
 * LL(1) predictive parser table.
 *
 * Maps a non terminal and a lookahead terminal to the productions predicted for this cell.
 * A cell with more than one production is an LL(1) conflict, the grammar is LL(1) iff there are none.
 */
public class LLParserTable {

	private static final Logger LOG = Config.logger(LLParserTable.class);

	public final Grammar grammar;

	/**
	 * Maps a non terminal and a lookahead terminal to the predicted productions.
	 */
	private final ImmutableTable<NonTerminal, Terminal, ImmutableSet<Production>> table;

	private final ImmutableList<Conflict<NonTerminal, Production>> conflicts;

	private LLParserTable(Grammar grammar, ImmutableTable<NonTerminal, Terminal, ImmutableSet<Production>> table,
	                      ImmutableList<Conflict<NonTerminal, Production>> conflicts){
		this.grammar = grammar;
		this.table = table;
		this.conflicts = conflicts;
	}

	/**
	 * Build the table: for every production A → α, insert it at (A, t) for every t ∈ FIRST(α) \ {ε} and,
	 * if ε ∈ FIRST(α), at (A, t) for every t ∈ FOLLOW(A).
	 *
	 * All productions are inserted even if conflicts occur.
	 */
	public static LLParserTable fromGrammar(Grammar grammar, FirstSets first, FollowSets follow){
		Preconditions.checkArgument(first.getGrammar() == grammar,
				"The first sets were calculated for another grammar");
		Preconditions.checkArgument(follow.getGrammar() == grammar,
				"The follow sets were calculated for another grammar");
		Map<NonTerminal, Map<Terminal, Set<Production>>> rows = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			rows.put(nonTerminal, new LinkedHashMap<>());
		}
		for (Production production : grammar.getProductions()){
			Set<Terminal> firstSet = first.ofTerm(production.right);
			for (Terminal lookahead : firstSet){
				if (!lookahead.isEpsilon()){
					insertAction(rows, production.left, lookahead, production);
				}
			}
			if (firstSet.contains(Terminal.EPSILON)){
				for (Terminal lookahead : follow.of(production.left)){
					insertAction(rows, production.left, lookahead, production);
				}
			}
		}
		ImmutableTable.Builder<NonTerminal, Terminal, ImmutableSet<Production>> builder = ImmutableTable.builder();
		List<Conflict<NonTerminal, Production>> conflicts = new ArrayList<>();
		for (Map.Entry<NonTerminal, Map<Terminal, Set<Production>>> row : rows.entrySet()){
			for (Map.Entry<Terminal, Set<Production>> cell : row.getValue().entrySet()){
				builder.put(row.getKey(), cell.getKey(), ImmutableSet.copyOf(cell.getValue()));
				if (cell.getValue().size() > 1){
					Conflict<NonTerminal, Production> conflict = new Conflict<>(Conflict.Kind.LL1, row.getKey(),
							cell.getKey(), cell.getValue());
					if (Config.logConflicts()){
						LOG.warning(conflict.toString());
					}
					conflicts.add(conflict);
				}
			}
		}
		return new LLParserTable(grammar, builder.build(), ImmutableList.copyOf(conflicts));
	}

	private static void insertAction(Map<NonTerminal, Map<Terminal, Set<Production>>> rows, NonTerminal nonTerminal,
	                                 Terminal lookahead, Production executedProduction){
		rows.get(nonTerminal).computeIfAbsent(lookahead, t -> new LinkedHashSet<>()).add(executedProduction);
	}

	/**
	 * Productions predicted for the passed non terminal and lookahead, empty if the cell is an error cell
	 */
	public ImmutableSet<Production> get(NonTerminal nonTerminal, Terminal lookahead){
		ImmutableSet<Production> cell = table.get(nonTerminal, lookahead);
		return cell == null ? ImmutableSet.of() : cell;
	}

	/**
	 * The single production predicted for the passed cell or null if the cell is empty or conflicting
	 */
	public Production getProduction(NonTerminal nonTerminal, Terminal lookahead){
		ImmutableSet<Production> cell = get(nonTerminal, lookahead);
		return cell.size() == 1 ? cell.iterator().next() : null;
	}

	/**
	 * All non empty cells
	 */
	public ImmutableTable<NonTerminal, Terminal, ImmutableSet<Production>> getCells(){
		return table;
	}

	public ImmutableList<Conflict<NonTerminal, Production>> getConflicts(){
		return conflicts;
	}

	public boolean isLL1(){
		return conflicts.isEmpty();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : table.rowKeySet()){
			if (builder.length() != 0){
				builder.append("\n");
			}
			builder.append(nonTerminal).append(" = {");
			for (Map.Entry<Terminal, ImmutableSet<Production>> cell : table.row(nonTerminal).entrySet()){
				builder.append(" ").append(cell.getKey()).append(" = {");
				for (Production production : cell.getValue()){
					builder.append(" ").append(production);
				}
				builder.append(" }");
			}
			builder.append(" }");
		}
		return builder.toString();
	}
}

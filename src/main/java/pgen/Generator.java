package pgen;

import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

import com.google.common.base.Suppliers;

import pgen.grammar.FirstSets;
import pgen.grammar.FollowSets;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.parser.ll.LLParserTable;
import pgen.parser.lr.CanonicalCollection;
import pgen.parser.lr.LRParserTable;
import pgen.util.Pair;

/**
 * Entry points of the grammar analysis.
 *
 * The static methods build each artifact separately. An instance computes the artifacts of a single
 * grammar lazily and at most once.
 */
public class Generator {

	private static final Logger LOG = Config.logger(Generator.class);

	public static Pair<FirstSets, FollowSets> buildFirstFollow(Grammar grammar){
		FirstSets first = FirstSets.calculate(Objects.requireNonNull(grammar));
		return new Pair<>(first, FollowSets.calculate(grammar, first));
	}

	public static LLParserTable buildLL1Table(Grammar grammar, FirstSets first, FollowSets follow){
		return LLParserTable.fromGrammar(grammar, first, follow);
	}

	public static CanonicalCollection buildLR0Automaton(Grammar grammar){
		return CanonicalCollection.createFromGrammar(Objects.requireNonNull(grammar));
	}

	public static LRParserTable buildSLR1Table(Grammar grammar, CanonicalCollection automaton, FollowSets follow){
		return LRParserTable.fromCollection(grammar, automaton, follow);
	}

	public final Grammar grammar;

	private final Supplier<Pair<FirstSets, FollowSets>> firstFollow;
	private final Supplier<LLParserTable> llTable;
	private final Supplier<CanonicalCollection> automaton;
	private final Supplier<LRParserTable> slrTable;

	public Generator(Grammar grammar) {
		this.grammar = Objects.requireNonNull(grammar);
		Set<NonTerminal> unreachable = grammar.getUnreachable();
		if (!unreachable.isEmpty()){
			LOG.warning("Non terminals not reachable from " + grammar.getStart() + ": " + unreachable);
		}
		this.firstFollow = Suppliers.memoize(() -> buildFirstFollow(grammar));
		this.llTable = Suppliers.memoize(() -> buildLL1Table(grammar, getFirstSets(), getFollowSets()));
		this.automaton = Suppliers.memoize(() -> buildLR0Automaton(grammar));
		this.slrTable = Suppliers.memoize(() -> buildSLR1Table(grammar, getAutomaton(), getFollowSets()));
	}

	public FirstSets getFirstSets(){
		return firstFollow.get().first;
	}

	public FollowSets getFollowSets(){
		return firstFollow.get().second;
	}

	public LLParserTable getLLTable(){
		return llTable.get();
	}

	public CanonicalCollection getAutomaton(){
		return automaton.get();
	}

	public LRParserTable getSLRTable(){
		return slrTable.get();
	}

	public boolean isLL1(){
		return getLLTable().isLL1();
	}

	public boolean isSLR1(){
		return getSLRTable().isSLR1();
	}
}

package pgen.parser.lr;

import java.util.HashSet;
import java.util.Set;

import org.jgrapht.Graph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import pgen.Grammars;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Symbol;
import pgen.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalCollectionTest {

	private static Symbol symbol(String name){
		return Character.isUpperCase(name.charAt(0)) ? new NonTerminal(name) : new Terminal(name);
	}

	@ParameterizedTest
	@CsvSource({
			"0, E, 1", "0, T, 2", "0, F, 3", "0, (, 4", "0, id, 5",
			"1, +, 6", "2, *, 7",
			"4, E, 8", "4, T, 2", "4, F, 3", "4, (, 4", "4, id, 5",
			"6, T, 9", "6, F, 3", "6, (, 4", "6, id, 5",
			"7, F, 10", "7, (, 4", "7, id, 5",
			"8, ), 11", "8, +, 6", "9, *, 7"
	})
	public void testExpressionTransitions(int from, String symbol, int to){
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(Grammars.expression());
		assertEquals(Integer.valueOf(to), collection.goTo(from, symbol(symbol)));
	}

	@Test
	public void testExpressionGrammar(){
		Grammar grammar = Grammars.expression();
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(grammar);
		assertEquals(12, collection.size());
		assertEquals(22, collection.getTransitions().size());
		assertSame(grammar, collection.getGrammar());
		assertEquals(new NonTerminal("E'"), collection.getAugmentedProduction().left);
		assertEquals(6, collection.getAugmentedProduction().id);
		assertEquals(7, collection.getStartState().getSituations().size());
		assertTrue(collection.transitionsOf(3).isEmpty());
		assertNull(collection.goTo(0, new Terminal("+")));
		assertTrue(collection.getUnreachableStates().isEmpty());
	}

	@Test
	public void testStatesAreUnique(){
		for (Grammar grammar : new Grammar[]{Grammars.expression(), Grammars.llExpression(), Grammars.danglingElse(),
				Grammars.ambiguous()}){
			CanonicalCollection collection = CanonicalCollection.createFromGrammar(grammar);
			Set<State> states = new HashSet<>(collection.getStates());
			assertEquals(collection.size(), states.size());
			for (int i = 0; i < collection.size(); i++){
				assertEquals(i, collection.getState(i).id);
			}
		}
	}

	/**
	 * Every transition target is the closure of the advanced items of its source
	 */
	@Test
	public void testTransitionsMatchGoTo(){
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(Grammars.llExpression());
		collection.getTransitions().cellSet().forEach(cell -> assertEquals(
				collection.getState(cell.getValue()).getSituations(),
				collection.getState(cell.getRowKey()).goTo(collection.getAugmentedGrammar(), cell.getColumnKey())));
		assertEquals(16, collection.size());
		assertEquals(26, collection.getTransitions().size());
	}

	@Test
	public void testDeterministicNumbering(){
		CanonicalCollection first = CanonicalCollection.createFromGrammar(Grammars.danglingElse());
		CanonicalCollection second = CanonicalCollection.createFromGrammar(Grammars.danglingElse());
		assertEquals(first.getStates(), second.getStates());
		assertEquals(first.getTransitions(), second.getTransitions());
		assertEquals(11, first.size());
	}

	@Test
	public void testSelfLoop(){
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(Grammars.ambiguous());
		assertEquals(4, collection.size());
		assertEquals(Integer.valueOf(3), collection.goTo(3, new NonTerminal("S")));
		assertEquals(Integer.valueOf(2), collection.goTo(3, new Terminal("a")));
	}

	@Test
	public void testAccepting(){
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(Grammars.expression());
		Situation accepting = new Situation(collection.getAugmentedProduction(), 1);
		assertTrue(collection.isAccepting(accepting));
		assertTrue(collection.getState(1).contains(accepting));
		assertFalse(collection.isAccepting(new Situation(collection.getAugmentedProduction())));
		assertFalse(collection.isAccepting(new Situation(collection.getGrammar().getProductionForId(5), 1)));
	}

	@Test
	public void testDirectedGraph(){
		CanonicalCollection collection = CanonicalCollection.createFromGrammar(Grammars.expression());
		Graph<Integer, CanonicalCollection.Transition> graph = collection.toDirectedGraph();
		assertEquals(12, graph.vertexSet().size());
		assertEquals(22, graph.edgeSet().size());
		assertEquals(5, graph.outDegreeOf(0));
		assertEquals(4, graph.inDegreeOf(4));
	}
}

package pgen.parser.ll;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import pgen.Generator;
import pgen.Grammars;
import pgen.grammar.FirstSets;
import pgen.grammar.FollowSets;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Terminal;
import pgen.parser.Conflict;

import static org.junit.jupiter.api.Assertions.*;

public class LLParserTableTest {

	private static LLParserTable table(Grammar grammar){
		FirstSets first = FirstSets.calculate(grammar);
		return LLParserTable.fromGrammar(grammar, first, FollowSets.calculate(grammar, first));
	}

	@Test
	public void testLLExpressionGrammar(){
		Grammar grammar = Grammars.llExpression();
		LLParserTable table = table(grammar);
		assertTrue(table.isLL1());
		assertTrue(table.getConflicts().isEmpty());
		NonTerminal e2 = new NonTerminal("E'");
		NonTerminal t2 = new NonTerminal("T'");
		assertEquals(grammar.getProductionForId(1), table.getProduction(e2, new Terminal("+")));
		assertEquals(grammar.getProductionForId(2), table.getProduction(e2, new Terminal(")")));
		assertEquals(grammar.getProductionForId(2), table.getProduction(e2, Terminal.EOF));
		assertEquals(grammar.getProductionForId(4), table.getProduction(t2, new Terminal("*")));
		assertEquals(grammar.getProductionForId(5), table.getProduction(t2, new Terminal("+")));
		assertEquals(grammar.getProductionForId(6), table.getProduction(new NonTerminal("F"), new Terminal("(")));
		assertEquals(grammar.getProductionForId(7), table.getProduction(new NonTerminal("F"), new Terminal("id")));
		assertEquals(grammar.getProductionForId(0), table.getProduction(new NonTerminal("E"), new Terminal("id")));
	}

	@Test
	public void testErrorCells(){
		LLParserTable table = table(Grammars.llExpression());
		assertTrue(table.get(new NonTerminal("F"), new Terminal("+")).isEmpty());
		assertNull(table.getProduction(new NonTerminal("E"), Terminal.EOF));
		assertTrue(table.get(new NonTerminal("E'"), new Terminal("*")).isEmpty());
	}

	@Test
	public void testCellsOnlyContainProductionsOfTheirRow(){
		LLParserTable table = table(Grammars.llExpression());
		assertEquals(13, table.getCells().size());
		table.getCells().cellSet().forEach(cell -> {
			for (Production production : cell.getValue()){
				assertEquals(cell.getRowKey(), production.left);
			}
			assertFalse(cell.getColumnKey().isEpsilon());
		});
	}

	@Test
	public void testLeftRecursion(){
		Grammar grammar = Grammars.expression();
		LLParserTable table = table(grammar);
		assertFalse(table.isLL1());
		assertEquals(4, table.getConflicts().size());
		Set<String> cells = new HashSet<>();
		for (Conflict<NonTerminal, Production> conflict : table.getConflicts()){
			assertEquals(Conflict.Kind.LL1, conflict.kind);
			assertEquals(Conflict.TableKind.LL1, conflict.kind.table);
			assertEquals(2, conflict.competing.size());
			cells.add(conflict.row + " " + conflict.lookahead);
		}
		assertEquals(new HashSet<>(Arrays.asList("E (", "E id", "T (", "T id")), cells);
		assertEquals(grammar.getProductionForId(5), table.getProduction(new NonTerminal("F"), new Terminal("id")));
	}

	@Test
	public void testAmbiguousGrammar(){
		Grammar grammar = Grammars.ambiguous();
		LLParserTable table = table(grammar);
		assertEquals(1, table.getConflicts().size());
		Conflict<NonTerminal, Production> conflict = table.getConflicts().get(0);
		assertEquals(new NonTerminal("S"), conflict.row);
		assertEquals(new Terminal("a"), conflict.lookahead);
		assertEquals(grammar.getProductions(), conflict.competing);
		assertEquals(2, table.get(new NonTerminal("S"), new Terminal("a")).size());
		assertNull(table.getProduction(new NonTerminal("S"), new Terminal("a")));
	}

	@Test
	public void testDanglingElse(){
		Grammar grammar = Grammars.danglingElse();
		LLParserTable table = table(grammar);
		assertEquals(1, table.getConflicts().size());
		Conflict<NonTerminal, Production> conflict = table.getConflicts().get(0);
		assertEquals(new NonTerminal("S'"), conflict.row);
		assertEquals(new Terminal("e"), conflict.lookahead);
		assertEquals(2, conflict.competing.get(0).id);
		assertEquals(3, conflict.competing.get(1).id);
		assertEquals(grammar.getProductionForId(3), table.getProduction(new NonTerminal("S'"), Terminal.EOF));
		assertTrue(conflict.toString().startsWith("LL(1) conflict at [S', e]"));
	}

	@Test
	public void testSetsOfOtherGrammar(){
		Grammar grammar = Grammars.llExpression();
		FirstSets first = FirstSets.calculate(grammar);
		FollowSets follow = FollowSets.calculate(grammar, first);
		assertThrows(IllegalArgumentException.class,
				() -> LLParserTable.fromGrammar(Grammars.llExpression(), first, follow));
	}

	@Test
	public void testGeneratorFacade(){
		Grammar grammar = Grammars.llExpression();
		assertEquals(table(grammar).getCells(), new Generator(grammar).getLLTable().getCells());
	}
}

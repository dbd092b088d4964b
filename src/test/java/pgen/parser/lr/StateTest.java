package pgen.parser.lr;

import java.util.Arrays;
import java.util.Collections;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import org.junit.jupiter.api.Test;

import pgen.Grammars;
import pgen.grammar.Grammar;
import pgen.grammar.NonTerminal;
import pgen.grammar.Production;
import pgen.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class StateTest {

	private final Grammar augmented = Grammars.expression().augment();

	private final Production start = augmented.getProductionForId(6);

	@Test
	public void testClosureOfStartItem(){
		ImmutableSortedSet<Situation> closure = State.closure(augmented, Collections.singletonList(new Situation(start)));
		assertEquals(7, closure.size());
		for (Production production : augmented.getProductions()){
			assertTrue(closure.contains(new Situation(production)));
		}
	}

	@Test
	public void testClosureIsIdempotent(){
		ImmutableSortedSet<Situation> closure = State.closure(augmented, Collections.singletonList(new Situation(start)));
		assertEquals(closure, State.closure(augmented, closure));
	}

	@Test
	public void testClosureInFrontOfTerminal(){
		Situation situation = new Situation(augmented.getProductionForId(0), 1);
		assertEquals(ImmutableSortedSet.of(situation), State.closure(augmented, Arrays.asList(situation, situation)));
	}

	@Test
	public void testGoTo(){
		ImmutableSortedSet<Situation> kernel = ImmutableSortedSet.of(new Situation(start));
		State state = new State(0, kernel, State.closure(augmented, kernel));
		assertEquals(ImmutableList.of(new NonTerminal("E"), new NonTerminal("T"), new NonTerminal("F"),
				new Terminal("("), new Terminal("id")), state.nextSymbols());
		assertEquals(ImmutableSortedSet.of(new Situation(augmented.getProductionForId(0), 1), new Situation(start, 1)),
				state.goTo(augmented, new NonTerminal("E")));
		ImmutableSortedSet<Situation> afterParen = state.goTo(augmented, new Terminal("("));
		assertEquals(7, afterParen.size());
		assertEquals(new Situation(augmented.getProductionForId(4), 1), afterParen.first());
		assertTrue(state.goTo(augmented, new Terminal("+")).isEmpty());
		assertTrue(state.advance(new Terminal(")")).isEmpty());
		assertTrue(state.hasShiftableSituations());
		assertEquals(kernel, state.getKernel());
	}

	@Test
	public void testCompletedState(){
		ImmutableSortedSet<Situation> kernel = ImmutableSortedSet.of(new Situation(augmented.getProductionForId(5), 1));
		State state = new State(5, kernel, State.closure(augmented, kernel));
		assertFalse(state.hasShiftableSituations());
		assertTrue(state.nextSymbols().isEmpty());
	}

	@Test
	public void testEqualityByItems(){
		ImmutableSortedSet<Situation> kernel = ImmutableSortedSet.of(new Situation(start));
		ImmutableSortedSet<Situation> closure = State.closure(augmented, kernel);
		assertEquals(new State(0, kernel, closure), new State(3, kernel, closure));
		assertEquals(new State(0, kernel, closure).hashCode(), new State(3, kernel, closure).hashCode());
	}
}

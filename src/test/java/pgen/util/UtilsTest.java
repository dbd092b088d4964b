package pgen.util;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import pgen.Grammars;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

	@Test
	public void testJoin(){
		assertEquals("a | b | c", Utils.join(Arrays.asList("a", "b", "c"), " | "));
		assertEquals("", Utils.join(Collections.emptyList(), ", "));
	}

	@Test
	public void testFormatSet(){
		assertEquals("{}", Utils.formatSet(Collections.emptySet()));
		assertEquals("{E, T, F}", Utils.formatSet(Grammars.expression().getNonTerminals()));
	}
}

package pgen;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.Map;
import java.util.logging.Level;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	private static int read(String content, Map<String, String> target) throws IOException {
		return Config.read(new BufferedReader(new StringReader(content)), target);
	}

	@Test
	public void testDefaults(){
		assertEquals("'", Config.augmentedSuffix());
		assertTrue(Config.logConflicts());
		assertEquals(Level.INFO, Config.logLevel());
		assertEquals(Config.defaults().keySet(), Config.asMap().keySet());
	}

	@Test
	public void testRead() throws IOException {
		Map<String, String> map = Config.defaults();
		int applied = read("# comment\n\n logConflicts =  no \naugmentedSuffix=_0\nno separator\n", map);
		assertEquals(2, applied);
		assertEquals("no", map.get("logConflicts"));
		assertEquals("_0", map.get("augmentedSuffix"));
		assertEquals("INFO", map.get("logLevel"));
	}

	@Test
	public void testUnknownKeysAreIgnored() throws IOException {
		Map<String, String> map = Config.defaults();
		assertEquals(1, read("color = red\nlogLevel = FINE", map));
		assertFalse(map.containsKey("color"));
		assertEquals("FINE", map.get("logLevel"));
	}

	@Test
	public void testValueWithSeparator() throws IOException {
		Map<String, String> map = Config.defaults();
		read("augmentedSuffix = =", map);
		assertEquals("=", map.get("augmentedSuffix"));
	}

	@Test
	public void testEmptySuffixFallsBackToDefault() throws IOException {
		Map<String, String> map = Config.defaults();
		read("augmentedSuffix =", map);
		assertEquals("", map.get("augmentedSuffix"));
		Config.validate(map);
		assertEquals("'", map.get("augmentedSuffix"));
	}

	@Test
	public void testInvalidLogLevelFallsBackToDefault() throws IOException {
		Map<String, String> map = Config.defaults();
		read("logLevel = LOUD\naugmentedSuffix = _", map);
		Config.validate(map);
		assertEquals("INFO", map.get("logLevel"));
		assertEquals("_", map.get("augmentedSuffix"));
	}

	@Test
	public void testConfigIsReadOnly(){
		assertThrows(UnsupportedOperationException.class, () -> Config.asMap().put("logLevel", "ALL"));
	}
}

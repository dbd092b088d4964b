package pgen;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global configuration.
 *
 * The defaults are overridden by the <code>pgen.ini</code> class path resource and afterwards by a
 * <code>pgen.ini</code> file in the working directory. Each line has the form <code>key = value</code>,
 * lines starting with <code>#</code> are comments.
 */
public class Config {

	public static final String configFile = "pgen.ini";

	/**
	 * Parent logger of all loggers in this library
	 */
	public static final Logger LOG = Logger.getLogger("pgen");

	private static final Map<String, String> config = defaults();

	static Map<String, String> defaults(){
		Map<String, String> map = new HashMap<>();
		map.put("logLevel", "INFO");
		map.put("logConflicts", "yes");
		map.put("augmentedSuffix", "'");
		return map;
	}

	/** Log every found conflict as a warning? */
	public static boolean logConflicts(){
		return config.get("logConflicts").equals("yes");
	}

	/**
	 * Suffix appended to the start symbol name to create the start symbol of the augmented grammar
	 */
	public static String augmentedSuffix(){
		return config.get("augmentedSuffix");
	}

	public static Level logLevel(){
		return Level.parse(config.get("logLevel"));
	}

	/**
	 * Logger for the passed class, the configuration is loaded before it is returned,
	 * so the configured log level applies.
	 */
	public static Logger logger(Class<?> clazz){
		return Logger.getLogger(clazz.getName());
	}

	public static Map<String, String> asMap(){
		return Collections.unmodifiableMap(config);
	}

	/**
	 * Reads <code>key = value</code> lines into the passed map, only known keys are accepted.
	 *
	 * @return number of applied entries
	 */
	static int read(BufferedReader reader, Map<String, String> target) throws IOException {
		int applied = 0;
		String line;
		while ((line = reader.readLine()) != null){
			line = line.trim();
			if (line.isEmpty() || line.startsWith("#") || !line.contains("=")){
				continue;
			}
			int sep = line.indexOf('=');
			String key = line.substring(0, sep).trim();
			String value = line.substring(sep + 1).trim();
			if (target.containsKey(key)){
				target.put(key, value);
				applied++;
			} else {
				LOG.warning("Unknown config key \"" + key + "\"");
			}
		}
		return applied;
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getResourceAsStream("/" + configFile)) {
			if (stream != null){
				read(new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)), config);
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read the config resource " + configFile, e);
		}
		File file = new File(configFile);
		if (file.exists()){
			try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
				read(reader, config);
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read the config file " + file.getAbsolutePath(), e);
			}
		}
		validate(config);
		LOG.setLevel(logLevel());
	}

	/**
	 * Replaces invalid values with their defaults
	 */
	static void validate(Map<String, String> config){
		try {
			Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException e) {
			LOG.warning("Invalid log level \"" + config.get("logLevel") + "\"");
			config.put("logLevel", defaults().get("logLevel"));
		}
		if (config.get("augmentedSuffix").isEmpty()){
			LOG.warning("The augmented start symbol suffix can't be empty");
			config.put("augmentedSuffix", defaults().get("augmentedSuffix"));
		}
	}

	static {
		loadConfig();
	}
}

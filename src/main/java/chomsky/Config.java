package chomsky;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;

/**
 * Settings of the command line tool, read from the optional {@value #configFile} in the working
 * directory (<code>key = value</code> per line).
 */
public class Config {

	public static final String configFile = "chomsky.ini";

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("logLevel", "WARNING");
		put("showSteps", "yes");
		put("maxWordLength", "4");
		put("maxWords", "10");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/**
	 * @throws ChomskyException if the configured value isn't a log level
	 */
	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException e){
			throw new ChomskyException(String.format("Invalid logLevel \"%s\" in %s", config.get("logLevel"), configFile));
		}
	}

	/** Print the grammar after each stage? */
	public static boolean showSteps(){
		return config.get("showSteps").equals("yes");
	}

	public static int maxWordLength(){
		return intValue("maxWordLength");
	}

	public static int maxWords(){
		return intValue("maxWords");
	}

	private static int intValue(String key){
		try {
			return Integer.parseInt(config.get(key));
		} catch (NumberFormatException e){
			throw new ChomskyException(String.format("Invalid %s \"%s\" in %s, expected an integer", key, config.get(key), configFile));
		}
	}

	/**
	 * Drop all values read from files
	 */
	static void reset(){
		config.clear();
		config.putAll(defaults);
	}

	static void load(File file) throws IOException {
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains("=")){
					String[] parts = line.split("=", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						System.err.println("Unknown config key \"" + key + "\"");
					}
				}
			}
		}
	}

	private static void loadConfig(){
		File file = new File(configFile);
		if (file.exists()){
			try {
				load(file);
			} catch (IOException e) {
				System.err.println(String.format("Can't read %s, using the defaults: %s", configFile, e.getMessage()));
			}
		}
	}

	static {
		loadConfig();
	}
}

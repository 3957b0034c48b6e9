package colongo;

import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

public class ColonGoOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-f Print the formatted input instead of the translation", aliases = { "-format" })
	public boolean formatOnly = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public List<String> inputFilePaths;

	// extracted from the JSON configuration file, or the defaults when there is none
	public TranslatorOptions translatorOptions;

	private Options plumeOptions;
	private String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public ColonGoOptions(String[] args) {
		plumeOptions = new Options("colongo [options] file...", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	public void parse() throws ColonGoOptionException {
		if (version) {
			System.out.println("colongo version " + VERSION);
			System.exit(0);
		}

		if (help || remainingArgs.length == 0) {
			printHelp();
			System.exit(0);
		}

		inputFilePaths = Arrays.asList(remainingArgs);

		if (configFilePath == null || configFilePath.isEmpty()) {
			translatorOptions = TranslatorOptions.defaults();
			return;
		}

		String s;

		try {
			byte[] jsonBytes = Files.readAllBytes(Paths.get(configFilePath));
			s = new String(jsonBytes, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new ColonGoOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;

		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new ColonGoOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}

		translatorOptions = new TranslatorOptions(config);
	}
}

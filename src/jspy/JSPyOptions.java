package jspy;

import jspy.model.py.PyRuntime;
import jspy.trans.TranslationOptions;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

public class JSPyOptions {
	public static final String VERSION = "0.1.0";

	private static final Pattern MODULE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

	@Option("Print the version and exit")
	public boolean version = false;

	@Option("-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"--quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINEST.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"--verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the configuration file, if any", aliases = {"--config"})
	public String configFilePath;

	@Option(value = "-o path of the Python file to write; defaults to the input path with a .py extension",
			aliases = {"--output"})
	public String outputFilePath;

	@Option(value = "Python module that provides the runtime helpers")
	public String runtimeModule;

	@Option(value = "Translate undeclared identifiers instead of rejecting them")
	public boolean relaxedBindings = false;

	public String inputFilePath;

	// effective values after merging the configuration file
	public String destFile;
	public boolean strictBindings = true;

	private final Options plumeOptions;
	private final String[] remainingArgs;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public JSPyOptions(String[] args) throws JSPyOptionException {
		plumeOptions = new Options("jspy [options] input.js", this);
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new JSPyOptionException(e.getMessage(), e);
		}
	}

	public void parse() throws JSPyOptionException {
		if (version) {
			System.out.println("JSPy version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		if (remainingArgs.length != 1) {
			throw new JSPyOptionException("Expected exactly one input file, got " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new JSPyOptionException("Error reading configuration file: " + ex.getMessage(), ex);
			}

			JSONObject config;
			try {
				config = new JSONObject(s);
			} catch (JSONException e) {
				throw new JSPyOptionException(configFilePath + ": parsing error: " + e.getMessage(), e);
			}
			applyConfig(config);
		}

		// command line flags take precedence over the configuration file
		if (runtimeModule == null) {
			runtimeModule = PyRuntime.DEFAULT_MODULE;
		}
		if (relaxedBindings) {
			strictBindings = false;
		}
		if (outputFilePath != null) {
			destFile = outputFilePath;
		}
		if (destFile == null) {
			destFile = defaultDestFile(inputFilePath);
		}

		if (!MODULE_NAME.matcher(runtimeModule).matches()) {
			throw new JSPyOptionException("Invalid runtime module name \"" + runtimeModule + "\"");
		}
	}

	/**
	 * Reads {@code runtime_module}, {@code strict_bindings} and {@code dest_file} from a configuration object.
	 * Values already set on the command line are kept.
	 */
	void applyConfig(JSONObject config) throws JSPyOptionException {
		try {
			if (config.has("runtime_module") && runtimeModule == null) {
				runtimeModule = config.getString("runtime_module");
			}
			if (config.has("strict_bindings")) {
				strictBindings = config.getBoolean("strict_bindings");
			}
			if (config.has("dest_file")) {
				destFile = config.getString("dest_file");
			}
		} catch (JSONException e) {
			throw new JSPyOptionException(configFilePath + ": " + e.getMessage(), e);
		}
	}

	static String defaultDestFile(String inputFilePath) {
		if (inputFilePath.endsWith(".js")) {
			return inputFilePath.substring(0, inputFilePath.length() - ".js".length()) + ".py";
		}
		return inputFilePath + ".py";
	}

	public TranslationOptions toTranslationOptions() {
		return new TranslationOptions(runtimeModule, strictBindings);
	}
}

package jspy;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class JSPyOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String writeConfig(String json) throws IOException {
		File config = folder.newFile("jspy.json");
		FileUtils.writeStringToFile(config, json, StandardCharsets.UTF_8);
		return config.getPath();
	}

	@Test
	public void testDefaults() throws JSPyOptionException {
		JSPyOptions options = new JSPyOptions(new String[]{"src/app.js"});
		options.parse();
		assertThat(options.inputFilePath, is("src/app.js"));
		assertThat(options.destFile, is("src/app.py"));
		assertThat(options.runtimeModule, is("js_compat"));
		assertTrue(options.strictBindings);
		assertTrue(options.toTranslationOptions().isStrictBindings());
	}

	@Test
	public void testOutputFlag() throws JSPyOptionException {
		JSPyOptions options = new JSPyOptions(new String[]{"-o", "out/generated.py", "app.js"});
		options.parse();
		assertThat(options.destFile, is("out/generated.py"));
	}

	@Test
	public void testDefaultDestFile() {
		assertThat(JSPyOptions.defaultDestFile("a/b.js"), is("a/b.py"));
		assertThat(JSPyOptions.defaultDestFile("x"), is("x.py"));
		assertThat(JSPyOptions.defaultDestFile("x.mjs"), is("x.mjs.py"));
	}

	@Test(expected = JSPyOptionException.class)
	public void testMissingInput() throws JSPyOptionException {
		new JSPyOptions(new String[0]).parse();
	}

	@Test(expected = JSPyOptionException.class)
	public void testTooManyInputs() throws JSPyOptionException {
		new JSPyOptions(new String[]{"a.js", "b.js"}).parse();
	}

	@Test
	public void testConfigFile() throws IOException, JSPyOptionException {
		String config = writeConfig("{\"runtime_module\": \"vendor.compat\", \"strict_bindings\": false, " +
				"\"dest_file\": \"build/app.py\"}");
		JSPyOptions options = new JSPyOptions(new String[]{"-c", config, "app.js"});
		options.parse();
		assertThat(options.runtimeModule, is("vendor.compat"));
		assertFalse(options.strictBindings);
		assertThat(options.destFile, is("build/app.py"));
		assertThat(options.toTranslationOptions().getRuntimeModule(), is("vendor.compat"));
	}

	@Test
	public void testCommandLineWinsOverConfigFile() throws IOException, JSPyOptionException {
		String config = writeConfig("{\"runtime_module\": \"vendor.compat\", \"dest_file\": \"build/app.py\"}");
		JSPyOptions options = new JSPyOptions(new String[]{"-c", config, "-o", "cli.py", "app.js"});
		options.runtimeModule = "cli_compat";
		options.relaxedBindings = true;
		options.parse();
		assertThat(options.runtimeModule, is("cli_compat"));
		assertThat(options.destFile, is("cli.py"));
		assertFalse(options.strictBindings);
	}

	@Test
	public void testInvalidRuntimeModule() throws IOException, JSPyOptionException {
		String config = writeConfig("{\"runtime_module\": \"not-a-module\"}");
		JSPyOptions options = new JSPyOptions(new String[]{"-c", config, "app.js"});
		try {
			options.parse();
			fail("expected an invalid module name to be rejected");
		} catch (JSPyOptionException e) {
			assertThat(e.getMessage(), is("Invalid runtime module name \"not-a-module\""));
		}
	}

	@Test(expected = JSPyOptionException.class)
	public void testMalformedConfigFile() throws IOException, JSPyOptionException {
		String config = writeConfig("{\"strict_bindings\": ");
		new JSPyOptions(new String[]{"-c", config, "app.js"}).parse();
	}

	@Test(expected = JSPyOptionException.class)
	public void testWrongConfigValueType() throws IOException, JSPyOptionException {
		String config = writeConfig("{\"strict_bindings\": \"maybe\"}");
		new JSPyOptions(new String[]{"-c", config, "app.js"}).parse();
	}

	@Test(expected = JSPyOptionException.class)
	public void testMissingConfigFile() throws JSPyOptionException {
		new JSPyOptions(new String[]{"-c", new File(folder.getRoot(), "absent.json").getPath(), "app.js"}).parse();
	}
}

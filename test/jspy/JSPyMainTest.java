package jspy;

import jspy.errors.Issue;
import jspy.trans.IOErrorIssue;
import jspy.trans.JSPyTranslator;
import jspy.trans.TranslationOptions;
import jspy.trans.issues.UnresolvedBindingIssue;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class JSPyMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File source(String name, String text) throws IOException {
		File file = new File(folder.getRoot(), name);
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void testWritesModuleNextToInput() throws IOException {
		String text = "var total = 0;\nfunction add(n) { total = total + n; }\nadd(2);\n";
		File input = source("counter.js", text);
		JSPyMain main = new JSPyMain(new String[]{"-q", input.getPath()});
		assertTrue(main.run());
		File output = new File(folder.getRoot(), "counter.py");
		assertThat(FileUtils.readFileToString(output, StandardCharsets.UTF_8),
				is(JSPyTranslator.translateToString(text, TranslationOptions.defaults())));
	}

	@Test
	public void testMissingInputFile() {
		JSPyMain main = new JSPyMain(new String[]{"-q", new File(folder.getRoot(), "absent.js").getPath()});
		assertFalse(main.run());
		Issue issue = main.getIssueContext().getIssues().get(0);
		assertThat(issue, instanceOf(IOErrorIssue.class));
	}

	@Test
	public void testTranslationIssueStopsOutput() throws IOException {
		File input = source("bad.js", "undeclared = 1;\n");
		File output = folder.newFile("bad.py");
		assertTrue(output.delete());
		JSPyMain main = new JSPyMain(new String[]{"-q", "-o", output.getPath(), input.getPath()});
		assertFalse(main.run());
		assertThat(main.getIssueContext().getIssues().get(0), instanceOf(UnresolvedBindingIssue.class));
		assertFalse(output.exists());
	}
}

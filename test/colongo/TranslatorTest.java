package colongo;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import colongo.errors.Issue;
import colongo.parser.GoParseException;

/**
 * Translates each test/golden/NAME.cgo and compares the result against NAME.go, or against the
 * issues listed one per line in NAME.err.
 */
@RunWith(Parameterized.class)
public class TranslatorTest {

	private static final Path GOLDEN = Paths.get("test", "golden");

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"mixed", false},
				{"declare", true},
				{"headers", false},
				{"labels", false},
				{"plain", true},
				{"mixed_errors", false},
				{"reserved", false},
				{"unexpected", false},
		});
	}

	private String name;
	// whether the expected output is free of ":=", so translating it again must change nothing
	private boolean stable;

	public TranslatorTest(String name, boolean stable) {
		this.name = name;
		this.stable = stable;
	}

	private static String read(Path path) throws IOException {
		return FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
	}

	@Test
	public void test() throws IOException, GoParseException {
		String inputName = name + ".cgo";
		byte[] input = FileUtils.readFileToByteArray(GOLDEN.resolve(inputName).toFile());
		TranslationResult result = new Translator().translate(inputName, input);

		File expectedIssues = GOLDEN.resolve(name + ".err").toFile();
		if (expectedIssues.exists()) {
			assertFalse(result.isSuccessful());
			assertThat(result.getTranslated(), is(nullValue()));
			List<String> messages = result.getIssues().stream()
					.map(Issue::getMessage)
					.collect(Collectors.toList());
			List<String> expected = new ArrayList<>(FileUtils.readLines(expectedIssues, StandardCharsets.UTF_8));
			assertThat(messages, is(expected));
			return;
		}

		assertTrue(result.getIssues().toString(), result.isSuccessful());
		String expected = read(GOLDEN.resolve(name + ".go"));
		assertThat(new String(result.getTranslated(), StandardCharsets.UTF_8), is(expected));
		// the inputs are already formatted, so formatting alone must not change them
		assertThat(new String(result.getFormatted(), StandardCharsets.UTF_8), is(read(GOLDEN.resolve(inputName))));

		if (stable) {
			TranslationResult again = new Translator().translate(name + ".go", result.getTranslated());
			assertThat(again.getIssues(), is(Collections.<Issue>emptyList()));
			assertThat(new String(again.getTranslated(), StandardCharsets.UTF_8), is(expected));
			assertThat(new String(again.getFormatted(), StandardCharsets.UTF_8), is(expected));
		}
	}

}

package colongo.trans.passes.desugar;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static colongo.trans.passes.desugar.DeclarationKind.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import colongo.model.golang.GoExpression;
import colongo.model.golang.GoSelectorExpression;
import colongo.model.golang.GoVariableName;
import colongo.util.SourceLocation;

public class DeclarationClassifierTest {

	private static GoVariableName name(String name) {
		return new GoVariableName(SourceLocation.unknown(), name);
	}

	@Test
	public void testMixed() {
		GoVariableName n = name(":n");
		Classification classification = DeclarationClassifier.classify(Arrays.asList(n, name("err")));
		assertThat(classification.getKinds(), is(Arrays.asList(DECLARE, REASSIGN)));
		assertThat(classification.getDeclareCount(), is(1));
		assertThat(classification.getReassignCount(), is(1));
		assertTrue(classification.isMixed());
		// the marker is gone once classified
		assertThat(n.getName(), is("n"));
	}

	@Test
	public void testBlankIsIgnored() {
		Classification classification = DeclarationClassifier.classify(Arrays.asList(name("_"), name(":err")));
		assertThat(classification.getKinds(), is(Arrays.asList(IGNORED, DECLARE)));
		assertFalse(classification.isMixed());
		assertTrue(classification.declaresAnything());
	}

	@Test
	public void testMissingRangeValue() {
		Classification classification = DeclarationClassifier.classify(Arrays.asList(name(":k"), null));
		assertThat(classification.getKinds(), is(Arrays.asList(DECLARE, IGNORED)));
	}

	@Test
	public void testNonNamesAreReassigned() {
		GoExpression field = new GoSelectorExpression(SourceLocation.unknown(), name("s"), "f");
		Classification classification = DeclarationClassifier.classify(Arrays.asList(field, name(":x")));
		assertThat(classification.getKinds(), is(Arrays.asList(REASSIGN, DECLARE)));
		assertTrue(classification.isMixed());
	}

	@Test
	public void testNoMarkers() {
		Classification classification = DeclarationClassifier.classify(Arrays.asList(name("a"), name("b")));
		assertFalse(classification.declaresAnything());
		assertThat(classification.getReassignCount(), is(2));
	}

	@Test
	public void testEmpty() {
		Classification classification = DeclarationClassifier.classify(Collections.emptyList());
		assertThat(classification.getKinds().size(), is(0));
		assertFalse(classification.declaresAnything());
	}

	@Test
	public void testTemporaryNames() {
		TemporaryNameCounter counter = new TemporaryNameCounter("tmp");
		List<String> names = Arrays.asList(counter.nextName(), counter.nextName(), counter.nextName());
		assertThat(names, is(Arrays.asList("tmp0", "tmp1", "tmp2")));
		assertThat(counter.getCount(), is(3));
	}

}

package jspy.model.py;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class PyModelEqualityTest {

	private static PyStatement logCall(String receiver, String method, String name) {
		return new PyExpressionStatement(new PyCall(
				new PyAttribute(new PyName(receiver), method),
				Collections.singletonList(new PyName(name))));
	}

	@Test
	public void testNamesCompareByText() {
		assertThat(new PyName("a"), is(new PyName("a")));
		assertThat(new PyName("a").hashCode(), is(new PyName("a").hashCode()));
		assertThat(new PyName("a"), not(new PyName("b")));
	}

	@Test
	public void testAttributesCompareTargetAndName() {
		PyAttribute attribute = new PyAttribute(new PyName("s"), "lower");
		assertThat(attribute, is(new PyAttribute(new PyName("s"), "lower")));
		assertThat(attribute.hashCode(), is(new PyAttribute(new PyName("s"), "lower").hashCode()));
		assertThat(attribute, not(new PyAttribute(new PyName("s"), "upper")));
		assertThat(attribute, not(new PyAttribute(new PyName("t"), "lower")));
	}

	@Test
	public void testSeparatelyBuiltStatementsAreEqual() {
		PyStatement first = new PyAssignment(new PyName("x"), new PyNumberLiteral(1));
		PyStatement second = new PyAssignment(new PyName("x"), new PyNumberLiteral(1));
		assertThat(first, is(second));
		assertThat(Arrays.asList(first, logCall("s", "append", "x")),
				is(Arrays.asList(second, logCall("s", "append", "x"))));
		assertThat(logCall("s", "append", "x"), not(logCall("s", "append", "y")));
	}
}

package jspy.scope;

import jspy.InternalCompilerError;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class ScopeResolverTest {

	@Test
	public void testDeclareAndLookup() {
		ScopeResolver resolver = new ScopeResolver();
		assertThat(resolver.declare("count"), is("count"));
		assertThat(resolver.lookup("count"), is("count"));
		assertTrue(resolver.isDeclared("count"));
		assertFalse(resolver.isDeclared("other"));
	}

	@Test
	public void testReservedNameIsRenamed() {
		ScopeResolver resolver = new ScopeResolver();
		assertThat(resolver.declare("class"), is("class_js"));
		assertThat(resolver.lookup("class"), is("class_js"));
	}

	@Test
	public void testUndeclaredLookupFallsBackToRename() {
		ScopeResolver resolver = new ScopeResolver();
		assertThat(resolver.lookup("pass"), is("pass_js"));
		assertThat(resolver.lookup("value"), is("value"));
	}

	// the same input always yields the same resolved name, across resolver instances
	@Test
	public void testDeterministic() {
		ScopeResolver a = new ScopeResolver();
		ScopeResolver b = new ScopeResolver();
		for (String name : new String[] {"x", "in", "None", "_js_re", "len"}) {
			assertThat(a.declare(name), is(b.declare(name)));
		}
	}

	@Test
	public void testInnerScopeSeesOuterNames() {
		ScopeResolver resolver = new ScopeResolver();
		resolver.declare("outer");
		resolver.enterScope();
		resolver.declare("inner");
		assertTrue(resolver.isDeclared("outer"));
		assertTrue(resolver.isDeclared("inner"));
		resolver.exitScope();
		assertFalse(resolver.isDeclared("inner"));
		assertThat(resolver.getDepth(), is(0));
	}

	@Test
	public void testBindingDepth() {
		ScopeResolver resolver = new ScopeResolver();
		resolver.declare("g");
		resolver.enterScope();
		resolver.declare("f");
		resolver.enterScope();
		resolver.declare("l");
		assertThat(resolver.getBinding("l"), is(ScopeResolver.Binding.LOCAL));
		assertThat(resolver.getBinding("f"), is(ScopeResolver.Binding.ENCLOSING_FUNCTION));
		assertThat(resolver.getBinding("g"), is(ScopeResolver.Binding.MODULE));
		assertThat(resolver.getBinding("nope"), is(ScopeResolver.Binding.UNDECLARED));
	}

	@Test
	public void testModuleNameIsLocalAtRoot() {
		ScopeResolver resolver = new ScopeResolver();
		resolver.declare("g");
		assertThat(resolver.getBinding("g"), is(ScopeResolver.Binding.LOCAL));
	}

	@Test
	public void testShadowing() {
		ScopeResolver resolver = new ScopeResolver();
		resolver.declare("x");
		resolver.enterScope();
		resolver.declare("x");
		assertThat(resolver.getBinding("x"), is(ScopeResolver.Binding.LOCAL));
	}

	@Test(expected = InternalCompilerError.class)
	public void testExitRootScope() {
		new ScopeResolver().exitScope();
	}
}

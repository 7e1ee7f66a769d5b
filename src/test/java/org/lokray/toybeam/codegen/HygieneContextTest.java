package org.lokray.toybeam.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HygieneContextTest
{
	@Test
	void everyNameGetsAFreshSuffix()
	{
		HygieneContext hygiene = new HygieneContext();
		assertEquals("Count@1", hygiene.bind("count"));
		assertEquals("_Tmp@2", hygiene.temporary("tmp"));
		assertEquals("_@3", hygiene.wildcard());
		assertEquals("_@4", hygiene.wildcard());
		assertEquals("Count@5", hygiene.bind("count"));
	}

	@Test
	void innerScopeShadowsAndExitRestores()
	{
		HygieneContext hygiene = new HygieneContext();
		String outer = hygiene.bind("x");
		hygiene.enterScope();
		String inner = hygiene.bind("x");

		assertNotEquals(outer, inner);
		assertEquals(inner, hygiene.resolve("x"));
		hygiene.exitScope();
		assertEquals(outer, hygiene.resolve("x"));
	}

	@Test
	void outerBindingsAreVisibleInside()
	{
		HygieneContext hygiene = new HygieneContext();
		String target = hygiene.bind("pid");
		hygiene.enterScope();
		assertTrue(hygiene.isBound("pid"));
		assertEquals(target, hygiene.resolve("pid"));
		assertNull(hygiene.resolve("other"));
		assertFalse(hygiene.isBound("other"));
	}

	@Test
	void bindingsGoneAfterScopeExit()
	{
		HygieneContext hygiene = new HygieneContext();
		hygiene.enterScope();
		hygiene.bind("tmp");
		hygiene.exitScope();
		assertFalse(hygiene.isBound("tmp"));
	}

	@Test
	void recordsBindingsWithDepth()
	{
		HygieneContext hygiene = new HygieneContext();
		hygiene.bind("a");
		hygiene.enterScope();
		hygiene.bind("b");
		hygiene.temporary("ignored");

		assertEquals(2, hygiene.getBindings().size());
		HygieneContext.Binding b = hygiene.getBindings().get(1);
		assertEquals("b", b.getSourceName());
		assertEquals("B@2", b.getTargetName());
		assertEquals(2, b.getDepth());
		assertEquals("b -> B@2", b.toString());
		assertThrows(UnsupportedOperationException.class, () -> hygiene.getBindings().clear());
	}

	@Test
	void cannotExitTheRootScope()
	{
		HygieneContext hygiene = new HygieneContext();
		assertEquals(1, hygiene.getDepth());
		assertThrows(IllegalStateException.class, hygiene::exitScope);
	}
}

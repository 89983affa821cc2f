package org.metricshub.dagalloc;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.dagalloc.backend.RegisterPool;

public class RegisterPoolTest {

	@Test
	public void testLowestFreeRegisterFirst() {
		RegisterPool pool = new RegisterPool(RegisterPool.UNBOUNDED);
		assertEquals("R1", pool.allocate());
		assertEquals("R2", pool.allocate());
		assertEquals("R3", pool.allocate());
		pool.release("R2");
		pool.release("R1");
		assertEquals("R1", pool.allocate());
		assertEquals("R2", pool.allocate());
		assertEquals(3, pool.getLiveCount());
		assertEquals(3, pool.getPeak());
	}

	@Test
	public void testPeak() {
		RegisterPool pool = new RegisterPool(RegisterPool.UNBOUNDED);
		pool.allocate();
		pool.allocate();
		pool.release("R1");
		pool.release("R2");
		pool.allocate();
		assertEquals(1, pool.getLiveCount());
		assertEquals(2, pool.getPeak());
		assertTrue(pool.isAllocated("R1"));
		assertFalse(pool.isAllocated("R2"));
		assertFalse(pool.isAllocated("R9"));
	}

	@Test
	public void testCappedPool() {
		RegisterPool pool = new RegisterPool(2);
		pool.allocate();
		pool.allocate();
		RegisterBudgetExceededException e = assertThrows(RegisterBudgetExceededException.class, pool::allocate);
		assertEquals(2, e.getBudget());
		assertEquals(3, e.getNeeded());

		pool.release("R2");
		assertEquals("R2", pool.allocate());
	}

	@Test
	public void testInvalidRelease() {
		RegisterPool pool = new RegisterPool(RegisterPool.UNBOUNDED);
		assertThrows(IllegalStateException.class, () -> pool.release("R1"));
		pool.allocate();
		pool.release("R1");
		assertThrows(IllegalStateException.class, () -> pool.release("R1"));
		assertThrows(IllegalArgumentException.class, () -> pool.release("X1"));
	}

	@Test
	public void testNegativeCapacity() {
		assertThrows(IllegalArgumentException.class, () -> new RegisterPool(-1));
	}
}

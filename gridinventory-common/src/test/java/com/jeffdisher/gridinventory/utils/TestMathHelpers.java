package com.jeffdisher.gridinventory.utils;

import org.junit.Assert;
import org.junit.Test;


public class TestMathHelpers
{
	@Test
	public void inclusiveBounds() throws Throwable
	{
		Assert.assertTrue(MathHelpers.isInRange(0, 0, 3));
		Assert.assertTrue(MathHelpers.isInRange(3, 0, 3));
		Assert.assertFalse(MathHelpers.isInRange(-1, 0, 3));
		Assert.assertFalse(MathHelpers.isInRange(4, 0, 3));
		// An empty range contains nothing.
		Assert.assertFalse(MathHelpers.isInRange(0, 0, -1));
	}
}

package com.jeffdisher.gridinventory.utils;


public class Assert
{
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Condition expected to be true");
		}
	}
}

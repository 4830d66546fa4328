package com.jeffdisher.gridinventory.utils;


/**
 * Small numeric helpers shared by the grid logic.
 */
public class MathHelpers
{
	/**
	 * @param value The value to check.
	 * @param min The lower bound (inclusive).
	 * @param max The upper bound (inclusive).
	 * @return True if min <= value <= max.
	 */
	public static boolean isInRange(int value, int min, int max)
	{
		return (value >= min) && (value <= max);
	}
}

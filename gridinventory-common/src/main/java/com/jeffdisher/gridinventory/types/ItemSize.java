package com.jeffdisher.gridinventory.types;


/**
 * The width and height of an item's rectangle, in grid cells.
 * Note that this is not validated when created:  the inventory rejects non-positive sizes when they are used.
 */
public record ItemSize(int width, int height)
{
	public final int area()
	{
		return this.width * this.height;
	}

	public final int longerSide()
	{
		return Math.max(this.width, this.height);
	}

	public final boolean isPositive()
	{
		return (this.width > 0) && (this.height > 0);
	}
}

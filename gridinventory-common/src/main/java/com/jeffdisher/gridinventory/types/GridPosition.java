package com.jeffdisher.gridinventory.types;


/**
 * A 0-based cell coordinate within an inventory grid.  When describing a placement, this is the anchor (top-left cell)
 * of the item's footprint.
 */
public record GridPosition(int x, int y)
{
	public final GridPosition getRelative(int rx, int ry)
	{
		return new GridPosition(this.x + rx, this.y + ry);
	}
}

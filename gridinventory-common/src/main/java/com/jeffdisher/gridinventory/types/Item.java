package com.jeffdisher.gridinventory.types;


/**
 * Represents one physical item which can be placed in an inventory.
 * The "id" is the handle the inventory uses to identify the item:  two instances with the same id are considered the
 * same item, so only one of them can be placed at a time.  The "name" is just a label and many items can share it.
 */
public record Item(int id
		, String name
		, ItemSize size
) {
	public final int width()
	{
		return this.size.width();
	}

	public final int height()
	{
		return this.size.height();
	}
}

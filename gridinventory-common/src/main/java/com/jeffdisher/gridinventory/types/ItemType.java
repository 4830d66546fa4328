package com.jeffdisher.gridinventory.types;


/**
 * A catalog entry describing a kind of item.  Each call to create() produces a distinct Item of this type.
 */
public record ItemType(String typeId
		, String name
		, ItemSize size
) {
	public final Item create(int itemId)
	{
		return new Item(itemId, this.name, this.size);
	}
}

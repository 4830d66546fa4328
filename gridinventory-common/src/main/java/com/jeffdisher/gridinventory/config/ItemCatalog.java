package com.jeffdisher.gridinventory.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.gridinventory.types.Item;
import com.jeffdisher.gridinventory.types.ItemSize;
import com.jeffdisher.gridinventory.types.ItemType;


/**
 * The kinds of items which exist, loaded from data, and the factory for new Item instances of those kinds.
 * Every Item created by one catalog has a distinct id.
 */
public class ItemCatalog
{
	public static final String DEFAULT_CATALOG_RESOURCE = "item_catalog.tablist";

	/**
	 * Loads the catalog bundled with this library.
	 * 
	 * @return The catalog (never null).
	 * @throws IOException There was a problem reading the resource.
	 * @throws TabListReader.TabListException The resource was malformed.
	 */
	public static ItemCatalog loadDefault() throws IOException, TabListReader.TabListException
	{
		ClassLoader loader = ItemCatalog.class.getClassLoader();
		return loadCatalog(loader.getResourceAsStream(DEFAULT_CATALOG_RESOURCE));
	}

	/**
	 * Loads the catalog from the tablist in the given stream.  Each line has the form:
	 * TYPE_ID<TAB>NAME<TAB>WIDTH<TAB>HEIGHT
	 * 
	 * @param stream The stream containing the tablist (closed when done).
	 * @return The catalog (never null).
	 * @throws IOException There was a problem with the stream.
	 * @throws TabListReader.TabListException The tablist was malformed.
	 */
	public static ItemCatalog loadCatalog(InputStream stream) throws IOException, TabListReader.TabListException
	{
		IValueTransformer<Integer> widths = new IValueTransformer.PositiveIntegerTransformer("width");
		IValueTransformer<Integer> heights = new IValueTransformer.PositiveIntegerTransformer("height");
		List<ItemType> types = new ArrayList<>();
		Map<String, ItemType> byId = new HashMap<>();
		TabListReader.readEntireFile((int lineNumber, String name, String[] parameters) -> {
			if (3 != parameters.length)
			{
				throw new TabListReader.TabListException(lineNumber, "Expected NAME, WIDTH, HEIGHT for \"" + name + "\"");
			}
			if (byId.containsKey(name))
			{
				throw new TabListReader.TabListException(lineNumber, "Duplicate item type: \"" + name + "\"");
			}
			ItemSize size = new ItemSize(widths.transform(lineNumber, parameters[1]), heights.transform(lineNumber, parameters[2]));
			ItemType type = new ItemType(name, parameters[0], size);
			types.add(type);
			byId.put(name, type);
		}, stream);
		return new ItemCatalog(types, byId);
	}


	private final List<ItemType> _types;
	private final Map<String, ItemType> _byId;
	private int _nextItemId;

	private ItemCatalog(List<ItemType> types, Map<String, ItemType> byId)
	{
		_types = Collections.unmodifiableList(types);
		_byId = byId;
		_nextItemId = 1;
	}

	/**
	 * @return All types, in the order they were defined.
	 */
	public List<ItemType> getTypes()
	{
		return _types;
	}

	/**
	 * Looks up an item type by its id.
	 * 
	 * @param typeId The ID of an ItemType.
	 * @return The type or null if not known.
	 */
	public ItemType getTypeById(String typeId)
	{
		return _byId.get(typeId);
	}

	/**
	 * Creates a new item of the given type with a fresh id.
	 * 
	 * @param typeId The ID of an ItemType.
	 * @return The new item or null if the type isn't known.
	 */
	public Item createItem(String typeId)
	{
		ItemType type = _byId.get(typeId);
		return (null != type)
				? createItem(type)
				: null
		;
	}

	/**
	 * Creates a new item of the given type with a fresh id.
	 * 
	 * @param type The type.
	 * @return The new item.
	 */
	public Item createItem(ItemType type)
	{
		int id = _nextItemId;
		_nextItemId += 1;
		return type.create(id);
	}
}

package com.jeffdisher.gridinventory.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.gridinventory.logic.GridInventory;
import com.jeffdisher.gridinventory.types.GridPosition;
import com.jeffdisher.gridinventory.types.Item;
import com.jeffdisher.gridinventory.types.ItemType;


/**
 * The description of an inventory's dimensions and initial contents, loaded from data.
 * The tablist has exactly one "size" record and then any number of item records:
 * size<TAB>WIDTH<TAB>HEIGHT
 * TYPE_ID                  (placed at the first free position)
 * TYPE_ID<TAB>X<TAB>Y      (placed with its anchor at X,Y)
 */
public class InventoryLayout
{
	public static final String DEFAULT_LAYOUT_RESOURCE = "default_layout.tablist";
	public static final String SIZE_RECORD = "size";

	/**
	 * Loads the layout bundled with this library.
	 * 
	 * @param catalog The catalog used to resolve item types.
	 * @return The layout (never null).
	 * @throws IOException There was a problem reading the resource.
	 * @throws TabListReader.TabListException The resource was malformed.
	 */
	public static InventoryLayout loadDefault(ItemCatalog catalog) throws IOException, TabListReader.TabListException
	{
		ClassLoader loader = InventoryLayout.class.getClassLoader();
		return loadLayout(catalog, loader.getResourceAsStream(DEFAULT_LAYOUT_RESOURCE));
	}

	/**
	 * Loads a layout from the tablist in the given stream.
	 * 
	 * @param catalog The catalog used to resolve item types.
	 * @param stream The stream containing the tablist (closed when done).
	 * @return The layout (never null).
	 * @throws IOException There was a problem with the stream.
	 * @throws TabListReader.TabListException The tablist was malformed.
	 */
	public static InventoryLayout loadLayout(ItemCatalog catalog, InputStream stream) throws IOException, TabListReader.TabListException
	{
		IValueTransformer<Integer> dimensions = new IValueTransformer.PositiveIntegerTransformer("dimension");
		IValueTransformer<Integer> coordinates = new IValueTransformer.NonNegativeIntegerTransformer("coordinate");
		IValueTransformer<ItemType> types = new IValueTransformer.ItemTypeTransformer(catalog);
		int[] size = new int[2];
		int[] lastLine = new int[1];
		List<Entry> entries = new ArrayList<>();
		TabListReader.readEntireFile((int lineNumber, String name, String[] parameters) -> {
			lastLine[0] = lineNumber;
			if (SIZE_RECORD.equals(name))
			{
				if (0 != size[0])
				{
					throw new TabListReader.TabListException(lineNumber, "Duplicate size record");
				}
				if (2 != parameters.length)
				{
					throw new TabListReader.TabListException(lineNumber, "Expected WIDTH, HEIGHT for size");
				}
				size[0] = dimensions.transform(lineNumber, parameters[0]);
				size[1] = dimensions.transform(lineNumber, parameters[1]);
			}
			else
			{
				ItemType type = types.transform(lineNumber, name);
				GridPosition anchor;
				if (0 == parameters.length)
				{
					anchor = null;
				}
				else if (2 == parameters.length)
				{
					anchor = new GridPosition(coordinates.transform(lineNumber, parameters[0]), coordinates.transform(lineNumber, parameters[1]));
				}
				else
				{
					throw new TabListReader.TabListException(lineNumber, "Expected no parameters or X, Y for \"" + name + "\"");
				}
				entries.add(new Entry(lineNumber, type, anchor));
			}
		}, stream);
		if (0 == size[0])
		{
			throw new TabListReader.TabListException(lastLine[0], "Missing size record");
		}
		return new InventoryLayout(catalog, size[0], size[1], Collections.unmodifiableList(entries));
	}


	public final int width;
	public final int height;
	public final List<Entry> entries;
	private final ItemCatalog _catalog;

	private InventoryLayout(ItemCatalog catalog, int width, int height, List<Entry> entries)
	{
		_catalog = catalog;
		this.width = width;
		this.height = height;
		this.entries = entries;
	}

	/**
	 * Creates a new inventory populated from this layout, creating a fresh item (through the catalog) for each entry.
	 * Entries with an explicit anchor are placed first, in file order, then the others are auto-placed, in file order.
	 * Entries which can't be placed are skipped and reported.
	 * 
	 * @return The inventory and the entries which were skipped.
	 */
	public Result buildInventory()
	{
		Map<Item, GridPosition> explicit = new LinkedHashMap<>();
		Map<Item, Entry> entryByItem = new LinkedHashMap<>();
		List<Item> automatic = new ArrayList<>();
		for (Entry entry : this.entries)
		{
			Item item = _catalog.createItem(entry.type);
			entryByItem.put(item, entry);
			if (null != entry.anchor)
			{
				explicit.put(item, entry.anchor);
			}
			else
			{
				automatic.add(item);
			}
		}
		GridInventory inventory = new GridInventory(this.width, this.height, explicit);
		for (Item item : automatic)
		{
			inventory.placeAnywhere(item);
		}
		
		List<Entry> skipped = new ArrayList<>();
		for (Map.Entry<Item, Entry> elt : entryByItem.entrySet())
		{
			if (!inventory.contains(elt.getKey()))
			{
				skipped.add(elt.getValue());
			}
		}
		return new Result(inventory, Collections.unmodifiableList(skipped));
	}


	/**
	 * One item record from the layout file.
	 * 
	 * @param lineNumber The line where this was defined.
	 * @param type The type of item to create.
	 * @param anchor The requested anchor or null if it should be auto-placed.
	 */
	public static record Entry(int lineNumber, ItemType type, GridPosition anchor)
	{
	}

	/**
	 * The output of buildInventory().
	 * 
	 * @param inventory The new inventory.
	 * @param skipped The entries which couldn't be placed.
	 */
	public static record Result(GridInventory inventory, List<Entry> skipped)
	{
	}
}

package com.jeffdisher.gridinventory.config;

import com.jeffdisher.gridinventory.config.TabListReader.TabListException;
import com.jeffdisher.gridinventory.types.ItemType;


/**
 * Used to transform a string field into a specific type.
 * 
 * @param <T> The output type.
 */
public interface IValueTransformer<T>
{
	T transform(int lineNumber, String value) throws TabListException;

	/**
	 * Decodes the given data as an Integer greater than 0.
	 */
	public static class PositiveIntegerTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		public PositiveIntegerTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Integer transform(int lineNumber, String value) throws TabListException
		{
			int parsed = _parse(lineNumber, _name, value);
			if (parsed <= 0)
			{
				throw new TabListException(lineNumber, "Values for " + _name + " must be positive: " + parsed);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as an Integer which is 0 or greater (grid coordinates, for example).
	 */
	public static class NonNegativeIntegerTransformer implements IValueTransformer<Integer>
	{
		private final String _name;
		public NonNegativeIntegerTransformer(String numberName)
		{
			_name = numberName;
		}
		@Override
		public Integer transform(int lineNumber, String value) throws TabListException
		{
			int parsed = _parse(lineNumber, _name, value);
			if (parsed < 0)
			{
				throw new TabListException(lineNumber, "Values for " + _name + " cannot be negative: " + parsed);
			}
			return parsed;
		}
	}

	/**
	 * Decodes the given data as an ItemType id from a catalog.
	 */
	public static class ItemTypeTransformer implements IValueTransformer<ItemType>
	{
		private final ItemCatalog _catalog;
		public ItemTypeTransformer(ItemCatalog catalog)
		{
			_catalog = catalog;
		}
		@Override
		public ItemType transform(int lineNumber, String value) throws TabListException
		{
			ItemType type = _catalog.getTypeById(value);
			if (null == type)
			{
				throw new TabListException(lineNumber, "Unknown item type: \"" + value + "\"");
			}
			return type;
		}
	}


	private static int _parse(int lineNumber, String name, String value) throws TabListException
	{
		try
		{
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new TabListException(lineNumber, "Not a valid " + name + ": \"" + value + "\"");
		}
	}
}

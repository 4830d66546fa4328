package com.jeffdisher.gridinventory.config;

import java.io.ByteArrayInputStream;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import com.jeffdisher.gridinventory.config.TabListReader.TabListException;
import com.jeffdisher.gridinventory.logic.GridInventory;
import com.jeffdisher.gridinventory.types.GridPosition;


public class TestInventoryLayout
{
	private static ItemCatalog CATALOG;
	@BeforeClass
	public static void setup() throws Throwable
	{
		CATALOG = ItemCatalog.loadCatalog(new ByteArrayInputStream((
				"coin\tCoin\t1\t1\n"
				+ "shield\tRound Shield\t2\t2\n"
				+ "bow\tLongbow\t1\t4\n"
		).getBytes()));
	}

	@Test
	public void explicitThenAutomatic() throws Throwable
	{
		// The coin is listed first but the explicit shield is placed before it.
		InventoryLayout layout = _load("size\t4\t3\ncoin\nshield\t0\t0\ncoin\n");
		Assert.assertEquals(4, layout.width);
		Assert.assertEquals(3, layout.height);
		Assert.assertEquals(3, layout.entries.size());
		Assert.assertNull(layout.entries.get(0).anchor());
		Assert.assertEquals(new GridPosition(0, 0), layout.entries.get(1).anchor());

		InventoryLayout.Result result = layout.buildInventory();
		GridInventory inventory = result.inventory();
		Assert.assertTrue(result.skipped().isEmpty());
		Assert.assertEquals(3, inventory.getItemCount());
		Assert.assertEquals("Round Shield", inventory.getItem(1, 1).name());
		Assert.assertEquals("Coin", inventory.getItem(2, 0).name());
		Assert.assertEquals("Coin", inventory.getItem(3, 0).name());
		Assert.assertEquals(2, inventory.countByName("Coin"));
	}

	@Test
	public void skippedEntries() throws Throwable
	{
		// The bow is too tall and the second shield overlaps the first.
		InventoryLayout layout = _load("size\t3\t2\nshield\t0\t0\nshield\t1\t0\nbow\ncoin\n");
		InventoryLayout.Result result = layout.buildInventory();
		Assert.assertEquals(2, result.inventory().getItemCount());
		Assert.assertEquals(2, result.skipped().size());
		Assert.assertEquals(3, result.skipped().get(0).lineNumber());
		Assert.assertEquals("bow", result.skipped().get(1).type().typeId());
	}

	@Test
	public void loadDefault() throws Throwable
	{
		ItemCatalog catalog = ItemCatalog.loadDefault();
		InventoryLayout layout = InventoryLayout.loadDefault(catalog);
		InventoryLayout.Result result = layout.buildInventory();
		Assert.assertTrue(result.skipped().isEmpty());
		Assert.assertEquals(layout.entries.size(), result.inventory().getItemCount());
	}

	@Test
	public void missingSize() throws Throwable
	{
		try
		{
			_load("coin\n# trailing comment\ncoin\n");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertTrue(e.getMessage().contains("Missing size"));
			Assert.assertEquals(3, e.lineNumber);
		}
	}

	@Test
	public void duplicateSize() throws Throwable
	{
		try
		{
			_load("size\t2\t2\nsize\t3\t3\n");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals(2, e.lineNumber);
		}
	}

	@Test(expected=TabListException.class)
	public void unknownType() throws Throwable
	{
		_load("size\t2\t2\nhelmet\n");
	}

	@Test(expected=TabListException.class)
	public void negativeCoordinate() throws Throwable
	{
		_load("size\t2\t2\ncoin\t-1\t0\n");
	}

	@Test(expected=TabListException.class)
	public void singleCoordinate() throws Throwable
	{
		_load("size\t2\t2\ncoin\t1\n");
	}


	private static InventoryLayout _load(String content) throws Throwable
	{
		return InventoryLayout.loadLayout(CATALOG, new ByteArrayInputStream(content.getBytes()));
	}
}

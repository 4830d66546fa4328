package com.jeffdisher.gridinventory.config;

import java.io.ByteArrayInputStream;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.gridinventory.config.TabListReader.TabListException;
import com.jeffdisher.gridinventory.types.Item;
import com.jeffdisher.gridinventory.types.ItemSize;
import com.jeffdisher.gridinventory.types.ItemType;


public class TestItemCatalog
{
	@Test
	public void loadDefault() throws Throwable
	{
		ItemCatalog catalog = ItemCatalog.loadDefault();
		Assert.assertFalse(catalog.getTypes().isEmpty());
		ItemType sword = catalog.getTypeById("sword");
		Assert.assertEquals("Iron Sword", sword.name());
		Assert.assertEquals(new ItemSize(1, 3), sword.size());
		Assert.assertNull(catalog.getTypeById("Iron Sword"));
	}

	@Test
	public void createItems() throws Throwable
	{
		ItemCatalog catalog = _load("coin\tCoin\t1\t1\nbedroll\tBedroll\t3\t1\n");
		Assert.assertEquals(2, catalog.getTypes().size());
		Assert.assertEquals("coin", catalog.getTypes().get(0).typeId());
		Item first = catalog.createItem("coin");
		Item second = catalog.createItem("coin");
		Item bedroll = catalog.createItem(catalog.getTypeById("bedroll"));
		Assert.assertNotEquals(first.id(), second.id());
		Assert.assertNotEquals(second.id(), bedroll.id());
		Assert.assertEquals("Coin", second.name());
		Assert.assertEquals(3, bedroll.width());
		Assert.assertEquals(1, bedroll.height());
		Assert.assertNull(catalog.createItem("missing"));
	}

	@Test
	public void duplicateType() throws Throwable
	{
		try
		{
			_load("coin\tCoin\t1\t1\ncoin\tOther Coin\t1\t1\n");
			Assert.fail();
		}
		catch (TabListException e)
		{
			Assert.assertEquals(2, e.lineNumber);
		}
	}

	@Test(expected=TabListException.class)
	public void zeroSize() throws Throwable
	{
		_load("coin\tCoin\t0\t1\n");
	}

	@Test(expected=TabListException.class)
	public void notANumber() throws Throwable
	{
		_load("coin\tCoin\tone\t1\n");
	}

	@Test(expected=TabListException.class)
	public void missingFields() throws Throwable
	{
		_load("coin\tCoin\t1\n");
	}


	private static ItemCatalog _load(String content) throws Throwable
	{
		return ItemCatalog.loadCatalog(new ByteArrayInputStream(content.getBytes()));
	}
}

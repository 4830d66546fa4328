package com.jeffdisher.gridinventory.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.jeffdisher.gridinventory.config.ItemCatalog;
import com.jeffdisher.gridinventory.logic.GridInventory;
import com.jeffdisher.gridinventory.types.GridPosition;
import com.jeffdisher.gridinventory.types.Item;


public class TestConsoleHandler
{
	// Each test gets a new catalog so that item ids start from 1.
	private ItemCatalog _catalog;
	@Before
	public void setup() throws Throwable
	{
		_catalog = ItemCatalog.loadCatalog(new ByteArrayInputStream((
				"coin\tCoin\t1\t1\n"
				+ "shield\tRound Shield\t2\t2\n"
		).getBytes()));
	}

	@Test
	public void basicStop() throws Throwable
	{
		String output = _run(new GridInventory(2, 2), "!stop\n");
		Assert.assertEquals("Shutting down...\n", output);
	}

	@Test
	public void endOfInput() throws Throwable
	{
		String output = _run(new GridInventory(2, 2), "");
		Assert.assertEquals("Shutting down...\n", output);
	}

	@Test
	public void unknownCommand() throws Throwable
	{
		String output = _run(new GridInventory(2, 2), "!dance\nhello\n!stop\n");
		Assert.assertEquals("Command \"dance\" unknown\nRun !help for commands\nRun !help for commands\nShutting down...\n", output);
	}

	@Test
	public void addAndPrint() throws Throwable
	{
		GridInventory inventory = new GridInventory(3, 2);
		String output = _run(inventory, "!add shield\n!add coin 2 1\n!add coin 0 0\n!print\n!stop\n");
		Assert.assertEquals("Added 1 (Round Shield, 2x2) at (0, 0)\n"
				+ "Added 2 (Coin, 1x1) at (2, 1)\n"
				+ "No room for coin\n"
				+ "[Round Shield][Round Shield][]\n"
				+ "[Round Shield][Round Shield][Coin]\n"
				+ "Shutting down...\n"
				, output
		);
		Assert.assertEquals(2, inventory.getItemCount());
	}

	@Test
	public void moveRemoveAndQuery() throws Throwable
	{
		GridInventory inventory = new GridInventory(4, 2);
		Item coin = _catalog.createItem("coin");
		Assert.assertTrue(inventory.place(coin, 0, 0));
		String input = "!move " + coin.id() + " 3 1\n"
				+ "!at 3 1\n"
				+ "!find 4 1\n"
				+ "!count Coin\n"
				+ "!remove " + coin.id() + "\n"
				+ "!remove " + coin.id() + "\n"
				+ "!at 3 1\n"
				+ "!stop\n"
		;
		String output = _run(inventory, input);
		String description = coin.id() + " (Coin, 1x1)";
		Assert.assertEquals("Moved " + description + " to (3, 1)\n"
				+ description + "\n"
				+ "Free at (0, 0)\n"
				+ "Coin: 1\n"
				+ "Removed " + description + " from (3, 1)\n"
				+ "Error: \"" + coin.id() + "\" is not a valid ID\n"
				+ "Empty\n"
				+ "Shutting down...\n"
				, output
		);
		Assert.assertTrue(inventory.isEmpty());
	}

	@Test
	public void badArguments() throws Throwable
	{
		GridInventory inventory = new GridInventory(2, 2);
		String output = _run(inventory, "!add\n!add helmet\n!move 1 x 0\n!find 0 1\n!stop\n");
		Assert.assertEquals("Usage:  <type> [<x> <y>]\n"
				+ "Error: \"helmet\" is not a known type\n"
				+ "Usage:  <id> <x> <y>\n"
				+ "Usage:  <width> <height>\n"
				+ "Shutting down...\n"
				, output
		);
	}

	@Test
	public void nonNumericCoordinates() throws Throwable
	{
		GridInventory inventory = new GridInventory(2, 2);
		String output = _run(inventory, "!add coin x 1\n!add coin 1 y\n!at 1 y\n!at x 0\n!stop\n");
		Assert.assertEquals("Usage:  <type> [<x> <y>]\n"
				+ "Usage:  <type> [<x> <y>]\n"
				+ "Usage:  <x> <y>\n"
				+ "Usage:  <x> <y>\n"
				+ "Shutting down...\n"
				, output
		);
		Assert.assertTrue(inventory.isEmpty());
		// The rejected commands didn't consume item ids.
		Assert.assertEquals(1, _catalog.createItem("coin").id());
	}

	@Test
	public void listTypes() throws Throwable
	{
		GridInventory inventory = new GridInventory(2, 2);
		String output = _run(inventory, "!types\n!stop\n");
		Assert.assertEquals("\tcoin - Coin (1x1)\n"
				+ "\tshield - Round Shield (2x2)\n"
				+ "Shutting down...\n"
				, output
		);
	}

	@Test
	public void reorganizeAndClear() throws Throwable
	{
		GridInventory inventory = new GridInventory(3, 2);
		Item coin = _catalog.createItem("coin");
		Item shield = _catalog.createItem("shield");
		Assert.assertTrue(inventory.place(coin, 0, 0));
		Assert.assertTrue(inventory.place(shield, 1, 0));
		String output = _run(inventory, "!reorganize\n!clear\n!clear\n!list\n!stop\n");
		Assert.assertEquals("Moved " + shield.id() + " (Round Shield, 2x2) to (0, 0)\n"
				+ "Moved " + coin.id() + " (Coin, 1x1) to (2, 0)\n"
				+ "Cleared\n"
				+ "Items (0):\n"
				+ "Shutting down...\n"
				, output
		);
		Assert.assertTrue(inventory.isEmpty());
	}


	private String _run(GridInventory inventory, String input) throws Throwable
	{
		InputStream in = new ByteArrayInputStream(input.getBytes());
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream printer = new PrintStream(out);
		inventory.addListener(new ConsoleEventLogger(printer));
		ConsoleHandler.readUntilStop(in, printer, _catalog, inventory);
		printer.flush();
		return out.toString();
	}
}

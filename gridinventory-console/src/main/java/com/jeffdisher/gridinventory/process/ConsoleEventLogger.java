package com.jeffdisher.gridinventory.process;

import java.io.PrintStream;

import com.jeffdisher.gridinventory.logic.GridInventory;
import com.jeffdisher.gridinventory.types.GridPosition;
import com.jeffdisher.gridinventory.types.Item;


/**
 * Writes one line to the given stream for every notification from the inventory it is listening to.
 */
public class ConsoleEventLogger implements GridInventory.IListener
{
	private final PrintStream _out;

	public ConsoleEventLogger(PrintStream out)
	{
		_out = out;
	}

	@Override
	public void itemAdded(Item item, GridPosition position)
	{
		_out.println("Added " + describeItem(item) + " at " + describePosition(position));
	}

	@Override
	public void itemRemoved(Item item, GridPosition position)
	{
		_out.println("Removed " + describeItem(item) + " from " + describePosition(position));
	}

	@Override
	public void itemMoved(Item item, GridPosition position)
	{
		_out.println("Moved " + describeItem(item) + " to " + describePosition(position));
	}

	@Override
	public void inventoryCleared()
	{
		_out.println("Cleared");
	}


	static String describeItem(Item item)
	{
		return item.id() + " (" + item.name() + ", " + item.width() + "x" + item.height() + ")";
	}

	static String describePosition(GridPosition position)
	{
		return "(" + position.x() + ", " + position.y() + ")";
	}
}

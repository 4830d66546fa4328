package com.jeffdisher.gridinventory.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.jeffdisher.gridinventory.config.ItemCatalog;
import com.jeffdisher.gridinventory.logic.GridInventory;
import com.jeffdisher.gridinventory.types.GridPosition;
import com.jeffdisher.gridinventory.types.Item;
import com.jeffdisher.gridinventory.types.ItemSize;
import com.jeffdisher.gridinventory.types.ItemType;
import com.jeffdisher.gridinventory.utils.GridFormatter;


/**
 * Handles the console's stdin, applying commands to a single inventory.
 */
public class ConsoleHandler
{
	/**
	 * Processes commands (on the calling thread) until a stop command is received or the input ends.
	 * 
	 * @param in The input stream.
	 * @param out The output stream.
	 * @param catalog The catalog used to create new items.
	 * @param inventory The inventory the commands operate on.
	 * @throws IOException If there was an error reading the input.
	 */
	public static void readUntilStop(InputStream in
			, PrintStream out
			, ItemCatalog catalog
			, GridInventory inventory
	) throws IOException
	{
		BufferedReader reader = new BufferedReader(new InputStreamReader(in));
		_ConsoleState state = new _ConsoleState(catalog, inventory);
		while (state.canContinue)
		{
			String line = reader.readLine();
			if (null != line)
			{
				_processOneLine(out, line, state);
			}
			else
			{
				// EOF is treated like a stop.
				state.canContinue = false;
			}
		}
		out.println("Shutting down...");
	}


	private static void _processOneLine(PrintStream out, String line, _ConsoleState state)
	{
		String[] fragments = line.trim().split(" ");
		String first = fragments[0];
		if (first.startsWith("!"))
		{
			String name = first.substring(1);
			
			// Drop any empty string fragments.
			List<String> nonEmpty = new ArrayList<>();
			for (int i = 1; i < fragments.length; ++i)
			{
				String fragment = fragments[i];
				if (fragment.length() > 0)
				{
					nonEmpty.add(fragment);
				}
			}
			String[] params = nonEmpty.toArray((int size) -> new String[size]);
			
			_Command command;
			try
			{
				command = _Command.valueOf(name.toUpperCase());
			}
			catch (IllegalArgumentException e)
			{
				command = null;
			}
			if (null != command)
			{
				command.handler.run(out, state, params);
			}
			else
			{
				out.println("Command \"" + name + "\" unknown");
				_usage(out);
			}
		}
		else if (!first.isEmpty())
		{
			_usage(out);
		}
	}

	private static void _usage(PrintStream out)
	{
		out.println("Run !help for commands");
	}

	private static int _readInt(String param, int defaultValue)
	{
		try
		{
			return Integer.parseInt(param);
		}
		catch (NumberFormatException e)
		{
			return defaultValue;
		}
	}

	private static Item _findItem(GridInventory inventory, int id)
	{
		Item found = null;
		for (Item item : inventory)
		{
			if (id == item.id())
			{
				found = item;
				break;
			}
		}
		return found;
	}


	private static class _ConsoleState
	{
		public boolean canContinue = true;
		public final ItemCatalog catalog;
		public final GridInventory inventory;
		public _ConsoleState(ItemCatalog catalog, GridInventory inventory)
		{
			this.catalog = catalog;
			this.inventory = inventory;
		}
	}

	private static interface _CommandHandler
	{
		void run(PrintStream out, _ConsoleState state, String[] parameters);
	}

	private static enum _Command
	{
		HELP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			out.println("Commands:");
			for (_Command command : _Command.values())
			{
				out.println("!" + command.name() + " " + command.usage);
			}
		}, ""),
		STOP((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.canContinue = false;
		}, ""),
		PRINT((PrintStream out, _ConsoleState state, String[] parameters) -> {
			GridInventory inventory = state.inventory;
			Item[][] matrix = new Item[inventory.getWidth()][inventory.getHeight()];
			inventory.copyGridTo(matrix);
			out.println(GridFormatter.gridToString(matrix));
		}, ""),
		LIST((PrintStream out, _ConsoleState state, String[] parameters) -> {
			GridInventory inventory = state.inventory;
			out.println("Items (" + inventory.getItemCount() + "):");
			for (Item item : inventory)
			{
				out.println("\t" + ConsoleEventLogger.describeItem(item) + " at " + ConsoleEventLogger.describePosition(inventory.getPosition(item)));
			}
		}, ""),
		TYPES((PrintStream out, _ConsoleState state, String[] parameters) -> {
			for (ItemType type : state.catalog.getTypes())
			{
				out.println("\t" + type.typeId() + " - " + type.name() + " (" + type.size().width() + "x" + type.size().height() + ")");
			}
		}, ""),
		ADD((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <type> or <type> <x> <y>.
			if ((1 == parameters.length) || (3 == parameters.length))
			{
				ItemType type = state.catalog.getTypeById(parameters[0]);
				if (null != type)
				{
					int x = (3 == parameters.length) ? _readInt(parameters[1], Integer.MIN_VALUE) : 0;
					int y = (3 == parameters.length) ? _readInt(parameters[2], Integer.MIN_VALUE) : 0;
					if ((Integer.MIN_VALUE != x) && (Integer.MIN_VALUE != y))
					{
						Item item = state.catalog.createItem(type);
						boolean didAdd = (3 == parameters.length)
								? state.inventory.place(item, x, y)
								: state.inventory.placeAnywhere(item)
						;
						if (!didAdd)
						{
							out.println("No room for " + type.typeId());
						}
					}
					else
					{
						out.println("Usage:  " + _Command.valueOf("ADD").usage);
					}
				}
				else
				{
					out.println("Error: \"" + parameters[0] + "\" is not a known type");
				}
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("ADD").usage);
			}
		}, "<type> [<x> <y>]"),
		REMOVE((PrintStream out, _ConsoleState state, String[] parameters) -> {
			if (parameters.length > 0)
			{
				for (String param : parameters)
				{
					Item item = _findItem(state.inventory, _readInt(param, -1));
					if (null != item)
					{
						state.inventory.remove(item);
					}
					else
					{
						out.println("Error: \"" + param + "\" is not a valid ID");
					}
				}
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("REMOVE").usage);
			}
		}, "<id>..."),
		MOVE((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <id> <x> <y>.
			if (3 == parameters.length)
			{
				Item item = _findItem(state.inventory, _readInt(parameters[0], -1));
				int x = _readInt(parameters[1], Integer.MIN_VALUE);
				int y = _readInt(parameters[2], Integer.MIN_VALUE);
				if ((null != item) && (Integer.MIN_VALUE != x) && (Integer.MIN_VALUE != y))
				{
					if (!state.inventory.moveItem(item, new GridPosition(x, y)))
					{
						out.println("Cannot move " + item.id() + " to (" + x + ", " + y + ")");
					}
				}
				else
				{
					out.println("Usage:  " + _Command.valueOf("MOVE").usage);
				}
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("MOVE").usage);
			}
		}, "<id> <x> <y>"),
		AT((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <x> <y>.
			if (2 == parameters.length)
			{
				int x = _readInt(parameters[0], Integer.MIN_VALUE);
				int y = _readInt(parameters[1], Integer.MIN_VALUE);
				if ((Integer.MIN_VALUE != x) && (Integer.MIN_VALUE != y))
				{
					Item item = state.inventory.tryGetItem(x, y);
					if (null != item)
					{
						out.println(ConsoleEventLogger.describeItem(item));
					}
					else
					{
						out.println("Empty");
					}
				}
				else
				{
					out.println("Usage:  " + _Command.valueOf("AT").usage);
				}
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("AT").usage);
			}
		}, "<x> <y>"),
		FIND((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// We expect <width> <height>.
			if (2 == parameters.length)
			{
				int width = _readInt(parameters[0], -1);
				int height = _readInt(parameters[1], -1);
				if ((width > 0) && (height > 0))
				{
					GridPosition position = state.inventory.findFreePosition(new ItemSize(width, height));
					if (null != position)
					{
						out.println("Free at " + ConsoleEventLogger.describePosition(position));
					}
					else
					{
						out.println("No room");
					}
				}
				else
				{
					out.println("Usage:  " + _Command.valueOf("FIND").usage);
				}
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("FIND").usage);
			}
		}, "<width> <height>"),
		COUNT((PrintStream out, _ConsoleState state, String[] parameters) -> {
			// Names can contain spaces so we join all the parameters.
			if (parameters.length > 0)
			{
				String name = String.join(" ", parameters);
				out.println(name + ": " + state.inventory.countByName(name));
			}
			else
			{
				out.println("Usage:  " + _Command.valueOf("COUNT").usage);
			}
		}, "<name>"),
		REORGANIZE((PrintStream out, _ConsoleState state, String[] parameters) -> {
			List<Item> dropped = state.inventory.reorganizeSpace();
			if (!dropped.isEmpty())
			{
				out.println("WARNING:  " + dropped.size() + " item(s) no longer fit and were dropped");
			}
		}, ""),
		CLEAR((PrintStream out, _ConsoleState state, String[] parameters) -> {
			state.inventory.clear();
		}, ""),
		;
		
		public final _CommandHandler handler;
		public final String usage;
		private _Command(_CommandHandler handler, String usage)
		{
			this.handler = handler;
			this.usage = usage;
		}
	}
}

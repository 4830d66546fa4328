package com.jeffdisher.gridinventory.process;

import java.io.FileInputStream;
import java.io.IOException;

import com.jeffdisher.gridinventory.config.InventoryLayout;
import com.jeffdisher.gridinventory.config.ItemCatalog;
import com.jeffdisher.gridinventory.config.TabListReader;
import com.jeffdisher.gridinventory.logic.GridInventory;


public class GridInventoryMain
{
	public static void main(String[] args)
	{
		// Either no arguments (use the bundled data) or 2:  catalog file and layout file.
		if ((0 == args.length) || (2 == args.length))
		{
			try
			{
				ItemCatalog catalog;
				InventoryLayout layout;
				if (0 == args.length)
				{
					catalog = ItemCatalog.loadDefault();
					layout = InventoryLayout.loadDefault(catalog);
				}
				else
				{
					catalog = ItemCatalog.loadCatalog(new FileInputStream(args[0]));
					layout = InventoryLayout.loadLayout(catalog, new FileInputStream(args[1]));
				}
				InventoryLayout.Result result = layout.buildInventory();
				for (InventoryLayout.Entry skipped : result.skipped())
				{
					System.out.println("WARNING:  Skipped " + skipped.type().typeId() + " (line " + skipped.lineNumber() + "):  no room");
				}
				GridInventory inventory = result.inventory();
				System.out.println("Inventory " + inventory.getWidth() + "x" + inventory.getHeight() + " with " + inventory.getItemCount() + " item(s)");
				inventory.addListener(new ConsoleEventLogger(System.out));
				
				// Hand over control to the ConsoleHandler.  Once it returns, we are done.
				ConsoleHandler.readUntilStop(System.in, System.out, catalog, inventory);
				System.out.println("Exiting normally");
			}
			catch (IOException e)
			{
				System.err.println("Failed to read data:  " + e.getMessage());
				System.exit(2);
			}
			catch (TabListReader.TabListException e)
			{
				System.err.println("Malformed data:  " + e.getMessage());
				System.exit(2);
			}
		}
		else
		{
			System.err.println("Usage:  GridInventoryMain [CATALOG_FILE LAYOUT_FILE]");
			System.exit(1);
		}
	}
}

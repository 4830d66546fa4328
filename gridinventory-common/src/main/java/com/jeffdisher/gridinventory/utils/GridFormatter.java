package com.jeffdisher.gridinventory.utils;

import com.jeffdisher.gridinventory.types.Item;


/**
 * Renders an inventory occupancy matrix as text, for consoles and test failure messages.
 */
public class GridFormatter
{
	/**
	 * Renders the given matrix, one grid row per line (no trailing line break).  Each cell is written as "[name]" or
	 * "[]" when empty.
	 * 
	 * @param grid The occupancy matrix, indexed [x][y] (as filled by GridInventory.copyGridTo()).
	 * @return The text rendering.
	 */
	public static String gridToString(Item[][] grid)
	{
		int width = grid.length;
		int height = (width > 0) ? grid[0].length : 0;
		StringBuilder builder = new StringBuilder();
		for (int y = 0; y < height; ++y)
		{
			if (y > 0)
			{
				builder.append("\n");
			}
			for (int x = 0; x < width; ++x)
			{
				Item item = grid[x][y];
				builder.append("[");
				if (null != item)
				{
					builder.append(item.name());
				}
				builder.append("]");
			}
		}
		return builder.toString();
	}
}

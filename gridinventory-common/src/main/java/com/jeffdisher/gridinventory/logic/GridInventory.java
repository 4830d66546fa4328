package com.jeffdisher.gridinventory.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import com.jeffdisher.gridinventory.types.GridPosition;
import com.jeffdisher.gridinventory.types.Item;
import com.jeffdisher.gridinventory.types.ItemSize;
import com.jeffdisher.gridinventory.utils.Assert;
import com.jeffdisher.gridinventory.utils.MathHelpers;


/**
 * A fixed-size 2D grid where rectangular items are placed without overlapping.
 * The grid and the placement index are always updated together, so every item in the index has its whole footprint
 * stamped into the grid and every non-empty cell belongs to exactly one indexed item.
 * Items are identified by their id (see Item).
 *
 * Negative outcomes which are part of normal use (cell occupied, out of bounds, item not present, no free space) are
 * reported as false or null returns.  Only caller bugs (bad dimensions or sizes, asserting lookups of absent items)
 * throw.
 *
 * This class is not thread-safe.  Listeners are called synchronously, on the mutating thread, once the mutation is
 * complete.
 */
public class GridInventory implements Iterable<Item>
{
	private static final Comparator<_Placement> REORGANIZE_ORDER = Comparator
			.comparingInt((_Placement placement) -> placement.item.size().area())
			.thenComparingInt((_Placement placement) -> placement.item.size().longerSide())
			.reversed()
	;

	private final int _width;
	private final int _height;
	// Indexed [x][y].
	private final Item[][] _grid;
	// Keyed by Item.id(), in insertion order.
	private final Map<Integer, _Placement> _placements;
	private final List<IListener> _listeners;

	/**
	 * Creates an empty inventory.
	 *
	 * @param width The number of columns (must be positive).
	 * @param height The number of rows (must be positive).
	 */
	public GridInventory(int width, int height)
	{
		if (width <= 0)
		{
			throw new InvalidDimensionException("Width must be positive: " + width);
		}
		if (height <= 0)
		{
			throw new InvalidDimensionException("Height must be positive: " + height);
		}
		_width = width;
		_height = height;
		_grid = new Item[width][height];
		_placements = new LinkedHashMap<>();
		// Notification loops iterate a snapshot so listeners can add or remove listeners while being called.
		_listeners = new CopyOnWriteArrayList<>();
	}

	/**
	 * Creates an inventory and auto-places the given items, in iteration order.  Items which are already present or
	 * can't fit are skipped.
	 *
	 * @param width The number of columns (must be positive).
	 * @param height The number of rows (must be positive).
	 * @param items The items to place.
	 */
	public GridInventory(int width, int height, Collection<Item> items)
	{
		this(width, height);
		Objects.requireNonNull(items);
		for (Item item : items)
		{
			Objects.requireNonNull(item);
			placeAnywhere(item);
		}
	}

	/**
	 * Creates an inventory and places the given items at their given anchors, in iteration order.  Items which are
	 * already present or can't be placed at their anchor are skipped.
	 *
	 * @param width The number of columns (must be positive).
	 * @param height The number of rows (must be positive).
	 * @param placements The items to place, mapped to their anchor positions.
	 */
	public GridInventory(int width, int height, Map<Item, GridPosition> placements)
	{
		this(width, height);
		Objects.requireNonNull(placements);
		for (Map.Entry<Item, GridPosition> elt : placements.entrySet())
		{
			Item item = Objects.requireNonNull(elt.getKey());
			GridPosition position = Objects.requireNonNull(elt.getValue());
			place(item, position);
		}
	}

	public int getWidth()
	{
		return _width;
	}

	public int getHeight()
	{
		return _height;
	}

	/**
	 * @return The number of items currently placed.
	 */
	public int getItemCount()
	{
		return _placements.size();
	}

	public boolean isEmpty()
	{
		return _placements.isEmpty();
	}

	public void addListener(IListener listener)
	{
		Objects.requireNonNull(listener);
		_listeners.add(listener);
	}

	public void removeListener(IListener listener)
	{
		_listeners.remove(listener);
	}

	public boolean canPlace(Item item, GridPosition position)
	{
		return canPlace(item, position.x(), position.y());
	}

	/**
	 * Checks if the item could be placed with its anchor at the given cell.
	 *
	 * @param item The item (null is never placeable).
	 * @param x The anchor column.
	 * @param y The anchor row.
	 * @return True if the item isn't already present and its whole footprint is in bounds and empty.
	 * @throws InvalidSizeException The item's size isn't positive in both dimensions.
	 */
	public boolean canPlace(Item item, int x, int y)
	{
		if (null == item)
		{
			return false;
		}
		_requirePositiveSize(item.size());
		return !contains(item)
				&& _isFootprintAvailable(null, item.size(), x, y)
		;
	}

	public boolean place(Item item, GridPosition position)
	{
		return place(item, position.x(), position.y());
	}

	/**
	 * Places the item with its anchor at the given cell, if canPlace() allows it.
	 *
	 * @param item The item to place.
	 * @param x The anchor column.
	 * @param y The anchor row.
	 * @return True if the item was placed, false if nothing changed.
	 * @throws InvalidSizeException The item's size isn't positive in both dimensions.
	 */
	public boolean place(Item item, int x, int y)
	{
		boolean didPlace = false;
		if (canPlace(item, x, y))
		{
			GridPosition position = new GridPosition(x, y);
			_stamp(item, position, item);
			_placements.put(item.id(), new _Placement(item, position));
			for (IListener listener : _listeners)
			{
				listener.itemAdded(item, position);
			}
			didPlace = true;
		}
		return didPlace;
	}

	/**
	 * @param item The item.
	 * @return True if the item isn't already present and there is room for it somewhere.
	 * @throws InvalidSizeException The item's size isn't positive in both dimensions.
	 */
	public boolean canPlaceAnywhere(Item item)
	{
		if (null == item)
		{
			return false;
		}
		return !contains(item)
				&& (null != findFreePosition(item.size()))
		;
	}

	/**
	 * Places the item at the position findFreePosition() selects for it.
	 *
	 * @param item The item.
	 * @return True if the item was placed, false if nothing changed.
	 * @throws InvalidSizeException The item's size isn't positive in both dimensions.
	 */
	public boolean placeAnywhere(Item item)
	{
		boolean didPlace = false;
		if ((null != item) && !contains(item))
		{
			GridPosition position = findFreePosition(item.size());
			if (null != position)
			{
				didPlace = place(item, position);
				Assert.assertTrue(didPlace);
			}
		}
		return didPlace;
	}

	/**
	 * Finds the first anchor, scanning rows from the top and then columns from the left within each row, where a
	 * rectangle of the given size would be fully in bounds and empty.
	 *
	 * @param size The size of the rectangle.
	 * @return The anchor or null if there is no room (including when the size is larger than the grid).
	 * @throws InvalidSizeException The size isn't positive in both dimensions.
	 */
	public GridPosition findFreePosition(ItemSize size)
	{
		Objects.requireNonNull(size);
		_requirePositiveSize(size);
		GridPosition found = null;
		if ((size.width() <= _width) && (size.height() <= _height))
		{
			for (int y = 0; (null == found) && (y <= (_height - size.height())); ++y)
			{
				for (int x = 0; (null == found) && (x <= (_width - size.width())); ++x)
				{
					if (_isFootprintAvailable(null, size, x, y))
					{
						found = new GridPosition(x, y);
					}
				}
			}
		}
		return found;
	}

	/**
	 * @param item The item (may be null).
	 * @return True if an item with this id is placed in the inventory.
	 */
	public boolean contains(Item item)
	{
		return (null != item) && _placements.containsKey(item.id());
	}

	public boolean isFree(GridPosition position)
	{
		return isFree(position.x(), position.y());
	}

	/**
	 * @param x The column.
	 * @param y The row.
	 * @return True if the cell is in bounds and empty (out-of-bounds cells are never free).
	 */
	public boolean isFree(int x, int y)
	{
		return _isInBounds(x, y) && (null == _grid[x][y]);
	}

	public boolean isOccupied(GridPosition position)
	{
		return isOccupied(position.x(), position.y());
	}

	/**
	 * @param x The column.
	 * @param y The row.
	 * @return True if the cell is not free (this includes out-of-bounds cells).
	 */
	public boolean isOccupied(int x, int y)
	{
		return !isFree(x, y);
	}

	/**
	 * Removes the item from the inventory.
	 *
	 * @param item The item (may be null).
	 * @return True if it was removed, false if it wasn't present.
	 */
	public boolean remove(Item item)
	{
		return (null != removeAndGetPosition(item));
	}

	/**
	 * Removes the item from the inventory.
	 *
	 * @param item The item (may be null).
	 * @return The anchor the item occupied before removal or null if it wasn't present.
	 */
	public GridPosition removeAndGetPosition(Item item)
	{
		GridPosition position = null;
		if (contains(item))
		{
			_Placement placement = _placements.remove(item.id());
			position = placement.position;
			_stamp(placement.item, position, null);
			for (IListener listener : _listeners)
			{
				listener.itemRemoved(placement.item, position);
			}
		}
		return position;
	}

	public Item getItem(GridPosition position)
	{
		return getItem(position.x(), position.y());
	}

	/**
	 * Looks up the item covering a cell, failing if there is none.
	 *
	 * @param x The column.
	 * @param y The row.
	 * @return The item whose footprint covers this cell.
	 * @throws ItemNotFoundException The cell is empty or out of bounds.
	 */
	public Item getItem(int x, int y)
	{
		Item item = tryGetItem(x, y);
		if (null == item)
		{
			throw new ItemNotFoundException("No item at (" + x + ", " + y + ")");
		}
		return item;
	}

	public Item tryGetItem(GridPosition position)
	{
		return tryGetItem(position.x(), position.y());
	}

	/**
	 * @param x The column.
	 * @param y The row.
	 * @return The item whose footprint covers this cell or null if it is empty or out of bounds.
	 */
	public Item tryGetItem(int x, int y)
	{
		return _isInBounds(x, y)
				? _grid[x][y]
				: null
		;
	}

	/**
	 * @param item The item.
	 * @return The item's anchor.
	 * @throws ItemNotFoundException The item isn't present.
	 */
	public GridPosition getPosition(Item item)
	{
		return _requirePlacement(item).position;
	}

	/**
	 * @param item The item (may be null).
	 * @return The item's anchor or null if it isn't present.
	 */
	public GridPosition tryGetPosition(Item item)
	{
		return contains(item)
				? _placements.get(item.id()).position
				: null
		;
	}

	/**
	 * Lists every cell the item covers, by row and then by column.
	 *
	 * @param item The item.
	 * @return The covered cells.
	 * @throws ItemNotFoundException The item isn't present.
	 */
	public List<GridPosition> getFootprint(Item item)
	{
		_Placement placement = _requirePlacement(item);
		return _footprint(placement.item.size(), placement.position);
	}

	/**
	 * @param item The item (may be null).
	 * @return The cells covered by the item (ordered as in getFootprint()) or null if it isn't present.
	 */
	public List<GridPosition> tryGetFootprint(Item item)
	{
		return contains(item)
				? getFootprint(item)
				: null
		;
	}

	/**
	 * Removes all items, notifying listeners once (and not at all if the inventory was already empty).
	 */
	public void clear()
	{
		if (!_placements.isEmpty())
		{
			_placements.clear();
			_wipeGrid();
			for (IListener listener : _listeners)
			{
				listener.inventoryCleared();
			}
		}
	}

	/**
	 * @param name The name to match (exact, case-sensitive).
	 * @return The number of placed items with this name.
	 */
	public int countByName(String name)
	{
		int count = 0;
		for (_Placement placement : _placements.values())
		{
			if (Objects.equals(placement.item.name(), name))
			{
				count += 1;
			}
		}
		return count;
	}

	/**
	 * Moves a placed item so that its anchor is the given position.  The item's current footprint doesn't block the
	 * move, only other items and the grid bounds do.  If the move isn't possible, nothing changes.
	 *
	 * @param item The item to move.
	 * @param newPosition The new anchor.
	 * @return True if the item was moved.
	 */
	public boolean moveItem(Item item, GridPosition newPosition)
	{
		boolean didMove = false;
		if (contains(item) && (null != newPosition))
		{
			_Placement old = _placements.get(item.id());
			if (_isFootprintAvailable(old.item, old.item.size(), newPosition.x(), newPosition.y()))
			{
				_stamp(old.item, old.position, null);
				_stamp(old.item, newPosition, old.item);
				_placements.put(item.id(), new _Placement(old.item, newPosition));
				for (IListener listener : _listeners)
				{
					listener.itemMoved(old.item, newPosition);
				}
				didMove = true;
			}
		}
		return didMove;
	}

	/**
	 * Repacks all items toward the top-left of the grid:  items are sorted by area and then by longer side (both
	 * descending, ties keep insertion order) and each one is given the first free position, in that order.
	 * First-fit packing can fail to fit items which fit before, so any such items are removed and returned.
	 * Listeners are told about each item whose anchor changed (itemMoved) and each item dropped (itemRemoved, with its
	 * old anchor).
	 *
	 * @return The items which no longer fit and were removed (empty in the common case).
	 */
	public List<Item> reorganizeSpace()
	{
		List<_Placement> ordered = new ArrayList<>(_placements.values());
		// List.sort() is stable so ties stay in insertion order.
		ordered.sort(REORGANIZE_ORDER);

		_placements.clear();
		_wipeGrid();

		List<_Placement> moved = new ArrayList<>();
		List<_Placement> dropped = new ArrayList<>();
		for (_Placement old : ordered)
		{
			GridPosition position = findFreePosition(old.item.size());
			if (null != position)
			{
				_stamp(old.item, position, old.item);
				_placements.put(old.item.id(), new _Placement(old.item, position));
				if (!position.equals(old.position))
				{
					moved.add(new _Placement(old.item, position));
				}
			}
			else
			{
				dropped.add(old);
			}
		}
		Assert.assertTrue((_placements.size() + dropped.size()) == ordered.size());

		for (IListener listener : _listeners)
		{
			for (_Placement placement : moved)
			{
				listener.itemMoved(placement.item, placement.position);
			}
			for (_Placement placement : dropped)
			{
				listener.itemRemoved(placement.item, placement.position);
			}
		}

		List<Item> droppedItems = new ArrayList<>();
		for (_Placement placement : dropped)
		{
			droppedItems.add(placement.item);
		}
		return Collections.unmodifiableList(droppedItems);
	}

	/**
	 * Copies the current occupancy into the given matrix.
	 *
	 * @param matrix A matrix indexed [x][y], which must be exactly [width][height].
	 * @throws InvalidDimensionException The matrix shape doesn't match the grid.
	 */
	public void copyGridTo(Item[][] matrix)
	{
		Objects.requireNonNull(matrix);
		if (_width != matrix.length)
		{
			throw new InvalidDimensionException("Matrix width " + matrix.length + " doesn't match " + _width);
		}
		for (int x = 0; x < _width; ++x)
		{
			if (_height != matrix[x].length)
			{
				throw new InvalidDimensionException("Matrix height " + matrix[x].length + " doesn't match " + _height);
			}
			System.arraycopy(_grid[x], 0, matrix[x], 0, _height);
		}
	}

	/**
	 * Iterates the placed items.  The iterator is lazy and read-only, and the order isn't meaningful.
	 */
	@Override
	public Iterator<Item> iterator()
	{
		Iterator<_Placement> placements = _placements.values().iterator();
		return new Iterator<>()
		{
			@Override
			public boolean hasNext()
			{
				return placements.hasNext();
			}
			@Override
			public Item next()
			{
				return placements.next().item;
			}
		};
	}


	private boolean _isInBounds(int x, int y)
	{
		return MathHelpers.isInRange(x, 0, _width - 1)
				&& MathHelpers.isInRange(y, 0, _height - 1)
		;
	}

	// Cells owned by "self" count as empty (null means no item is ignored).
	private boolean _isFootprintAvailable(Item self, ItemSize size, int x, int y)
	{
		boolean isAvailable = _isInBounds(x, y)
				&& _isInBounds(x + size.width() - 1, y + size.height() - 1)
		;
		for (int j = 0; isAvailable && (j < size.height()); ++j)
		{
			for (int i = 0; isAvailable && (i < size.width()); ++i)
			{
				Item existing = _grid[x + i][y + j];
				isAvailable = (null == existing) || ((null != self) && (self.id() == existing.id()));
			}
		}
		return isAvailable;
	}

	private void _stamp(Item item, GridPosition position, Item value)
	{
		ItemSize size = item.size();
		for (int i = 0; i < size.width(); ++i)
		{
			for (int j = 0; j < size.height(); ++j)
			{
				_grid[position.x() + i][position.y() + j] = value;
			}
		}
	}

	private void _wipeGrid()
	{
		for (Item[] column : _grid)
		{
			for (int y = 0; y < column.length; ++y)
			{
				column[y] = null;
			}
		}
	}

	private static List<GridPosition> _footprint(ItemSize size, GridPosition anchor)
	{
		List<GridPosition> cells = new ArrayList<>(size.area());
		for (int j = 0; j < size.height(); ++j)
		{
			for (int i = 0; i < size.width(); ++i)
			{
				cells.add(anchor.getRelative(i, j));
			}
		}
		return Collections.unmodifiableList(cells);
	}

	private _Placement _requirePlacement(Item item)
	{
		Objects.requireNonNull(item);
		_Placement placement = _placements.get(item.id());
		if (null == placement)
		{
			throw new ItemNotFoundException("Item not in inventory: " + item.id() + " (" + item.name() + ")");
		}
		return placement;
	}

	private static void _requirePositiveSize(ItemSize size)
	{
		if (!size.isPositive())
		{
			throw new InvalidSizeException("Item size must be positive: " + size.width() + "x" + size.height());
		}
	}


	private static record _Placement(Item item, GridPosition position)
	{
	}


	/**
	 * The interface of the notifications sent by the inventory to interested parties (UI, analytics, etc).
	 * All calls are made after the inventory has finished the change and is consistent.
	 */
	public static interface IListener
	{
		/**
		 * Called when an item is placed.
		 *
		 * @param item The item.
		 * @param position Its anchor.
		 */
		void itemAdded(Item item, GridPosition position);
		/**
		 * Called when an item is removed (including when dropped by reorganizeSpace()).
		 *
		 * @param item The item.
		 * @param position The anchor it occupied before removal.
		 */
		void itemRemoved(Item item, GridPosition position);
		/**
		 * Called when an item's anchor changes.
		 *
		 * @param item The item.
		 * @param position Its new anchor.
		 */
		void itemMoved(Item item, GridPosition position);
		/**
		 * Called once when all items are removed by clear().
		 */
		void inventoryCleared();
	}

	/**
	 * Thrown when the grid dimensions (or the dimensions of a matrix given to copyGridTo()) are invalid.
	 */
	public static class InvalidDimensionException extends IllegalArgumentException
	{
		private static final long serialVersionUID = 1L;
		public InvalidDimensionException(String message)
		{
			super(message);
		}
	}

	/**
	 * Thrown when an item size isn't positive in both dimensions.
	 */
	public static class InvalidSizeException extends IllegalArgumentException
	{
		private static final long serialVersionUID = 1L;
		public InvalidSizeException(String message)
		{
			super(message);
		}
	}

	/**
	 * Thrown by the asserting lookups when the requested item or cell isn't there.
	 */
	public static class ItemNotFoundException extends NoSuchElementException
	{
		private static final long serialVersionUID = 1L;
		public ItemNotFoundException(String message)
		{
			super(message);
		}
	}
}

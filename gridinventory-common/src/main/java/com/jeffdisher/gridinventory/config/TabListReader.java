package com.jeffdisher.gridinventory.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;


/**
 * Reads the "tab list" data files used to describe item catalogs and inventory layouts.
 * The format is line-oriented so that it stays trivial to edit by hand:
 * -each non-empty line is a record whose fields are separated by tabs
 * -the first field is the record name and the rest are its parameters
 * -lines starting with '#' are comments
 * -no field may start or end with whitespace (this catches spaces typed where a tab was intended)
 */
public class TabListReader
{
	/**
	 * Parses a full tab list from the given stream, sending each record to the given callbacks object.
	 * Closes the stream on completion.
	 * 
	 * @param callbacks Will receive the records as the parse runs.
	 * @param stream The stream containing the data (will be closed when done).
	 * @throws IOException There was a problem reading the stream.
	 * @throws TabListException The data wasn't well-formed.
	 */
	public static void readEntireFile(IParseCallbacks callbacks, InputStream stream) throws IOException, TabListException
	{
		if (null == stream)
		{
			throw new IOException("Resource missing");
		}
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
		{
			int lineNumber = 0;
			String line = reader.readLine();
			while (null != line)
			{
				lineNumber += 1;
				_handleLine(callbacks, lineNumber, line);
				line = reader.readLine();
			}
		}
	}


	private static void _handleLine(IParseCallbacks callbacks, int lineNumber, String line) throws TabListException
	{
		// Skip empty lines or lines which start with '#' (comments).
		if ((line.length() > 0) && ('#' != line.charAt(0)))
		{
			String[] parts = line.split("\t", -1);
			for (String part : parts)
			{
				if (part.isEmpty())
				{
					throw new TabListException(lineNumber, "Empty field");
				}
				if (part.trim().length() < part.length())
				{
					throw new TabListException(lineNumber, "Field edges cannot be whitespace: \"" + part + "\"");
				}
			}
			String[] parameters = new String[parts.length - 1];
			System.arraycopy(parts, 1, parameters, 0, parameters.length);
			callbacks.handleRecord(lineNumber, parts[0], parameters);
		}
	}


	/**
	 * The interface which receives callbacks from the parse operation.
	 */
	public interface IParseCallbacks
	{
		/**
		 * Called for each record in the file, in order.
		 * 
		 * @param lineNumber The 1-based line number of the record (for error messages).
		 * @param name The first field of the record.
		 * @param parameters The remaining fields (may be empty).
		 * @throws TabListException The record was invalid in this context.
		 */
		void handleRecord(int lineNumber, String name, String[] parameters) throws TabListException;
	}

	/**
	 * Used for logical errors within the tablist file.
	 */
	public static class TabListException extends Exception
	{
		private static final long serialVersionUID = 1L;
		public final int lineNumber;
		public TabListException(int lineNumber, String message)
		{
			super("Line " + lineNumber + ": " + message);
			this.lineNumber = lineNumber;
		}
	}
}

package org.fortrex.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the expressions that failed to parse or build while the driver keeps going.
 */
public class ErrorHandler
{
	private final List<String> errors = new ArrayList<>();

	public void logError(Path file, int line, String msg)
	{
		String location = file != null ? file.toString() : "<input>";
		String err = String.format("[Expression Error] %s - line %d - %s", location, line, msg);
		Debug.logError(err);
		errors.add(err);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public int getErrorCount()
	{
		return errors.size();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}
}

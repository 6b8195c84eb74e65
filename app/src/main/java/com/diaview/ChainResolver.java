package com.diaview;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a requested asset id into its layer stack by following parent links
 * until an id without a parent is reached. The returned list is in paint
 * order: base layer first, requested id last.
 */
public final class ChainResolver
{

	private ChainResolver()
	{
	}

	public static List<String> resolve(AssetCatalog catalog, String requestedId) throws RenderException
	{
		if (requestedId == null || requestedId.isEmpty())
		{
			throw RenderException.invalidArgument("Requested ID cannot be empty");
		}

		Deque<String> chain = new ArrayDeque<>();
		Set<String> visited = new HashSet<>();
		String current = requestedId;

		while (current != null)
		{
			// Checked before following the edge, so a self-reference fails on its second visit
			if (!visited.add(current))
			{
				throw RenderException.circularDependency(current);
			}
			chain.addFirst(current);
			current = catalog.parentOf(current).orElse(null);
		}

		return List.copyOf(chain);
	}
}

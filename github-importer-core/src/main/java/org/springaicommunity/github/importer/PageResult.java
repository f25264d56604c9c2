package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a cursor-paginated listing.
 *
 * @param <T> the type of items in the page
 * @param items the items of this page
 * @param nextCursor cursor for fetching the next page (null if no more pages)
 * @param hasMore whether there are more items available
 */
public record PageResult<T>(List<T> items, @Nullable String nextCursor, boolean hasMore) {

	public static <T> PageResult<T> empty() {
		return new PageResult<>(List.of(), null, false);
	}

}

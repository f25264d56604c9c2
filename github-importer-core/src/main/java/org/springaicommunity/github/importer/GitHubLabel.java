package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * A label of the target repository.
 *
 * @param id the label's database ID
 * @param name the label name (unique within the repository)
 * @param color the hex color code (without the # prefix)
 * @param description an optional description
 */
public record GitHubLabel(long id, String name, @Nullable String color, @Nullable String description)
		implements Identifiable {

	@Override
	public Long numericId() {
		return id;
	}

}

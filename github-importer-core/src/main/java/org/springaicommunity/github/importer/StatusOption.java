package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * A selectable option of a project's status field.
 *
 * @param id the option's node ID
 * @param name the option name shown as a board column
 * @param color the option color (BLUE, GRAY, GREEN, ORANGE, PINK, PURPLE, RED, YELLOW)
 */
public record StatusOption(String id, String name, @Nullable String color) implements Identifiable {

	@Override
	public String key() {
		return id;
	}

}

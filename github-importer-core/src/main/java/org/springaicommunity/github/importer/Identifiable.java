package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * An entity that an {@link EntityReference} can be resolved against.
 *
 * <p>
 * Numeric references match {@link #numericId()} or {@link #secondaryId()}; name references
 * match {@link #name()} or, for entities identified by an opaque string,
 * {@link #key()}. Comparison is exact.
 */
public interface Identifiable {

	/**
	 * Name or title of the entity.
	 * @return the name
	 */
	String name();

	/**
	 * Numeric database identifier, if the entity has one.
	 * @return the id, or {@code null}
	 */
	default @Nullable Long numericId() {
		return null;
	}

	/**
	 * Secondary numeric identifier (e.g. a milestone number), if the entity has one.
	 * @return the number, or {@code null}
	 */
	default @Nullable Long secondaryId() {
		return null;
	}

	/**
	 * Opaque string identifier, if the entity has one.
	 * @return the key, or {@code null}
	 */
	default @Nullable String key() {
		return null;
	}

}

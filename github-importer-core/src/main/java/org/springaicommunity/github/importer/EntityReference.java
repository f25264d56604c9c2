package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A user-declared reference to an entity, either by name or by numeric ID.
 *
 * <p>
 * Exactly one of {@code name} and {@code id} is set.
 *
 * @param name the referenced name (non-empty) when referencing by name
 * @param id the referenced numeric ID when referencing by ID
 */
public record EntityReference(@Nullable String name, @Nullable Long id) {

	public EntityReference {
		if ((name == null) == (id == null)) {
			throw new IllegalArgumentException("A reference is either a name or an ID");
		}
		if (name != null && name.isEmpty()) {
			throw new IllegalArgumentException("A name reference must not be empty");
		}
	}

	public static EntityReference ofName(String name) {
		return new EntityReference(name, null);
	}

	public static EntityReference ofId(long id) {
		return new EntityReference(null, id);
	}

	public boolean isNumeric() {
		return id != null;
	}

	/**
	 * Returns the referenced name.
	 * @return the name
	 * @throws IllegalStateException if this is a numeric reference
	 */
	public String requireName() {
		if (name == null) {
			throw new IllegalStateException("Reference " + id + " is numeric");
		}
		return name;
	}

	@Override
	public String toString() {
		return name != null ? name : String.valueOf(Objects.requireNonNull(id));
	}

}

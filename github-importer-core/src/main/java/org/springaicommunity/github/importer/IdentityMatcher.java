package org.springaicommunity.github.importer;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves an {@link EntityReference} against candidate entities.
 *
 * <p>
 * A numeric reference matches a candidate whose numeric ID or number equals it. A name
 * reference matches a candidate whose name, or opaque string key, equals it exactly: no
 * trimming, no case folding, no partial matches. The first matching candidate in
 * iteration order wins.
 */
public final class IdentityMatcher {

	private IdentityMatcher() {
	}

	public static <T extends Identifiable> Optional<T> find(EntityReference reference, Iterable<T> candidates) {
		for (T candidate : candidates) {
			if (matches(reference, candidate)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolve a plain string reference, as used for Trello list IDs and names.
	 * @param reference list ID or name
	 * @param candidates candidates in board order
	 * @return first match
	 */
	public static <T extends Identifiable> Optional<T> find(String reference, Iterable<T> candidates) {
		return find(EntityReference.ofName(reference), candidates);
	}

	public static boolean matches(EntityReference reference, Identifiable candidate) {
		if (reference.isNumeric()) {
			Long id = reference.id();
			return Objects.equals(id, candidate.numericId()) || Objects.equals(id, candidate.secondaryId());
		}
		String name = reference.name();
		return Objects.equals(name, candidate.name()) || Objects.equals(name, candidate.key());
	}

}

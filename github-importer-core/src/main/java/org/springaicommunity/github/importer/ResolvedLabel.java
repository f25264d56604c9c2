package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of resolving one source label, or one list-level label rule, against the
 * target repository.
 *
 * <p>
 * Consumers switch over {@link #kind()} with a switch expression so that adding a
 * variant fails compilation at every consumption site.
 */
public sealed interface ResolvedLabel {

	enum Kind {

		SKIPPED, TO_CREATE, MAPPED, MISSING, LIST_MAPPED, MISSING_LIST

	}

	Kind kind();

	/**
	 * No rule names this source label; cards lose it.
	 */
	record Skipped(TrelloLabel source) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.SKIPPED;
		}

	}

	/**
	 * The label is created on the target before issues are created.
	 */
	record ToCreate(TrelloLabel source, String name, @Nullable String color) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.TO_CREATE;
		}

	}

	record Mapped(TrelloLabel source, GitHubLabel target) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.MAPPED;
		}

	}

	/**
	 * The rule's reference matches no target label.
	 */
	record Missing(TrelloLabel source, EntityReference lookup) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.MISSING;
		}

	}

	/**
	 * Every card of {@code list} receives {@code target}.
	 */
	record ListMapped(TrelloList list, GitHubLabel target) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.LIST_MAPPED;
		}

	}

	record MissingList(TrelloList list, EntityReference lookup) implements ResolvedLabel {

		@Override
		public Kind kind() {
			return Kind.MISSING_LIST;
		}

	}

}

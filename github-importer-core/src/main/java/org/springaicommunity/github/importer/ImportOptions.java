package org.springaicommunity.github.importer;

/**
 * Switches of one import run.
 *
 * @param keepClosed import archived cards
 * @param keepClosedLists import cards of archived lists
 * @param dryRun resolve and validate only; perform no write against GitHub
 */
public record ImportOptions(boolean keepClosed, boolean keepClosedLists, boolean dryRun) {

	public static ImportOptions defaults() {
		return new ImportOptions(false, false, false);
	}

	public ImportOptions withDryRun(boolean dryRun) {
		return new ImportOptions(keepClosed, keepClosedLists, dryRun);
	}

}

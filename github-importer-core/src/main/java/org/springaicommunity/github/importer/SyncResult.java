package org.springaicommunity.github.importer;

/**
 * Outcome of reconciling the statuses of items already on the project.
 *
 * @param itemsFound project items linked to issues
 * @param updated items whose status was changed
 * @param skipped items left alone: no matching card, no status for the card's list, or
 * status already correct
 */
public record SyncResult(int itemsFound, int updated, int skipped) {

	public static SyncResult none() {
		return new SyncResult(0, 0, 0);
	}

}

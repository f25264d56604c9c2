package org.springaicommunity.github.importer;

/**
 * Counts of what a completed import wrote to GitHub.
 *
 * @param labelsCreated labels created
 * @param labelsAlreadyExisting labels marked for creation that GitHub reported as
 * existing
 * @param existingItemsUpdated items already on the project whose status was changed
 * @param existingItemsSkipped items already on the project left alone
 * @param issuesCreated issues created, one per imported card
 * @param commentsCreated comments posted on created issues
 * @param itemsAddedToProject created issues added to the project
 * @param statusesSet statuses set on newly added project items
 */
public record ImportSummary(int labelsCreated, int labelsAlreadyExisting, int existingItemsUpdated,
		int existingItemsSkipped, int issuesCreated, int commentsCreated, int itemsAddedToProject, int statusesSet) {
}

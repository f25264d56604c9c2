package org.springaicommunity.github.importer;

/**
 * A status option that does not exist yet and that the user asked to create
 * ({@code create = true}). Project field options cannot be created through the API, so
 * it has to be added by hand before re-running.
 *
 * @param listId the Trello list the status is for
 * @param name the option to create
 */
public record PendingStatus(String listId, String name) {
}

package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * An issue already present on the target project.
 *
 * @param id the project item's node ID
 * @param issueNumber number of the linked issue
 * @param issueTitle title of the linked issue
 * @param currentStatus name of the item's current status option, or {@code null}
 */
public record ProjectItem(String id, int issueNumber, String issueTitle, @Nullable String currentStatus) {
}

package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * A {@code [[lists]]} entry of the mapping file.
 *
 * <p>
 * The status, label and milestone references are independent of each other. The
 * {@code create} flag applies to the status reference only.
 *
 * @param list Trello list ID or name
 * @param status project status option reference
 * @param label repository label reference
 * @param milestone repository milestone reference
 * @param create whether a missing status option is to be created manually
 */
public record ListRule(String list, @Nullable EntityReference status, @Nullable EntityReference label,
		@Nullable EntityReference milestone, boolean create) {
}

package org.springaicommunity.github.importer;

/**
 * A list rule whose Trello list reference resolved.
 *
 * @param list the Trello list
 * @param rule the rule as declared
 */
public record ResolvedListRule(TrelloList list, ListRule rule) {
}

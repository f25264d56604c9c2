package org.springaicommunity.github.importer;

/**
 * @param number the issue number
 * @param nodeId the issue's GraphQL node ID
 * @param htmlUrl link to the issue
 */
public record CreatedIssue(int number, String nodeId, String htmlUrl) {
}

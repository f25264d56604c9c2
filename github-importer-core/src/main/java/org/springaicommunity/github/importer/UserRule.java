package org.springaicommunity.github.importer;

/**
 * A {@code [[users]]} entry of the mapping file.
 *
 * @param trello Trello member ID, username or full name
 * @param github GitHub login
 */
public record UserRule(String trello, String github) {
}

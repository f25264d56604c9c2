package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * @param id the user's database ID
 * @param login the user's login
 * @param name the user's display name, if public
 */
public record GitHubUser(long id, String login, @Nullable String name) {
}

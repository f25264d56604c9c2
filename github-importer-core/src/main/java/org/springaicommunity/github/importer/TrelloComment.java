package org.springaicommunity.github.importer;

import java.time.Instant;

/**
 * A {@code commentCard} action of the source board.
 *
 * @param id the Trello action ID
 * @param memberId ID of the member who wrote the comment
 * @param memberUsername username of the member who wrote the comment
 * @param cardId the commented card
 * @param text the comment text
 * @param date when the comment was written
 */
public record TrelloComment(String id, String memberId, String memberUsername, String cardId, String text,
		Instant date) {
}

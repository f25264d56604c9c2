package org.springaicommunity.github.importer;

import java.util.List;

/**
 * A card of the source board.
 *
 * @param id the Trello card ID
 * @param name the card title
 * @param url link back to the card
 * @param closed whether the card is archived
 * @param desc the card description (may be empty)
 * @param checklistIds IDs of the checklists displayed on the card
 * @param listId ID of the list the card belongs to
 * @param memberIds IDs of the members assigned to the card
 * @param labels labels attached to the card
 * @param attachments files and links attached to the card
 */
public record TrelloCard(String id, String name, String url, boolean closed, String desc, List<String> checklistIds,
		String listId, List<String> memberIds, List<TrelloLabel> labels, List<TrelloAttachment> attachments) {

	public TrelloCard {
		checklistIds = List.copyOf(checklistIds);
		memberIds = List.copyOf(memberIds);
		labels = List.copyOf(labels);
		attachments = List.copyOf(attachments);
	}

}

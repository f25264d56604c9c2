package org.springaicommunity.github.importer;

import java.util.List;

/**
 * A checklist rendered next to the description of a card.
 *
 * @param id the Trello checklist ID
 * @param name the checklist title
 * @param cardId the card displaying the checklist
 * @param checkItems the items in board order
 */
public record TrelloChecklist(String id, String name, String cardId, List<CheckItem> checkItems) {

	public TrelloChecklist {
		checkItems = List.copyOf(checkItems);
	}

	/**
	 * @param id the Trello check item ID
	 * @param name the item text
	 * @param complete whether the item is checked
	 */
	public record CheckItem(String id, String name, boolean complete) {
	}

}

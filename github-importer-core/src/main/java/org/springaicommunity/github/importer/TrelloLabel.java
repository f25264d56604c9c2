package org.springaicommunity.github.importer;

/**
 * A label defined on the source board.
 *
 * @param id the Trello label ID
 * @param name the label name (may be empty for color-only labels)
 * @param color the Trello color name
 * @param uses number of cards carrying the label
 */
public record TrelloLabel(String id, String name, String color, int uses) {
}

package org.springaicommunity.github.importer;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable snapshot of an exported Trello board.
 *
 * <p>
 * Cards reference lists, labels, checklists and members by ID; the reader guarantees
 * nothing beyond the shape of the export, so lookups return {@link Optional}.
 *
 * @param name the board name
 * @param lists the lists of the board
 * @param members the members of the board
 * @param comments the comment actions of the board
 * @param cards the cards of the board
 * @param labels the labels defined on the board
 * @param checklists the checklists of the board
 */
public record TrelloBoard(String name, List<TrelloList> lists, List<TrelloMember> members,
		List<TrelloComment> comments, List<TrelloCard> cards, List<TrelloLabel> labels,
		List<TrelloChecklist> checklists) {

	public TrelloBoard {
		lists = List.copyOf(lists);
		members = List.copyOf(members);
		comments = List.copyOf(comments);
		cards = List.copyOf(cards);
		labels = List.copyOf(labels);
		checklists = List.copyOf(checklists);
	}

	public Optional<TrelloList> findList(String listId) {
		return lists.stream().filter(list -> list.id().equals(listId)).findFirst();
	}

	public Optional<TrelloMember> findMember(String memberId) {
		return members.stream().filter(member -> member.id().equals(memberId)).findFirst();
	}

	public Optional<TrelloChecklist> findChecklist(String checklistId) {
		return checklists.stream().filter(checklist -> checklist.id().equals(checklistId)).findFirst();
	}

	/**
	 * Returns a copy of this board keeping only the cards matching the predicate.
	 * @param keep predicate selecting the cards to keep
	 * @return filtered board
	 */
	public TrelloBoard withCards(Predicate<TrelloCard> keep) {
		return new TrelloBoard(name, lists, members, comments, cards.stream().filter(keep).toList(), labels,
				checklists);
	}

	/**
	 * Returns a copy of this board without the cards of the given lists.
	 * @param listIds IDs of the lists whose cards are dropped
	 * @return filtered board
	 */
	public TrelloBoard withoutCardsInLists(Set<String> listIds) {
		return withCards(card -> !listIds.contains(card.listId()));
	}

}

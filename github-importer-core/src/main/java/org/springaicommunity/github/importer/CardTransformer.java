package org.springaicommunity.github.importer;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

/**
 * Converts Trello cards into {@link IssueDraft issue drafts} using a resolved plan.
 */
public class CardTransformer {

	static final String SECTION_SEPARATOR = "\n\n---\n\n";

	private static final DateTimeFormatter COMMENT_DATE = DateTimeFormatter.ISO_LOCAL_DATE
		.withZone(ZoneOffset.UTC);

	private final MigrationPlan plan;

	public CardTransformer(MigrationPlan plan) {
		this.plan = plan;
	}

	public IssueDraft transform(TrelloCard card) {
		GitHubMilestone milestone = plan.milestones().get(card.listId());
		return new IssueDraft(card.name(), body(card), labels(card), assignees(card),
				milestone != null ? milestone.number() : null, comments(card));
	}

	/**
	 * Render the issue body: the description, a checklist section and a footer linking the
	 * card and its attachments. Empty sections are left out together with their separator.
	 * @param card the card
	 * @return Markdown body
	 */
	public String body(TrelloCard card) {
		List<String> sections = new ArrayList<>();
		if (!card.desc().isEmpty()) {
			sections.add(card.desc());
		}
		checklists(card).ifPresent(sections::add);

		StringBuilder footer = new StringBuilder("> Migrated from [Trello Card](").append(card.url()).append(")");
		for (TrelloAttachment attachment : card.attachments()) {
			footer.append("\n- [").append(attachment.name()).append("](").append(attachment.url()).append(")");
		}
		sections.add(footer.toString());

		return String.join(SECTION_SEPARATOR, sections);
	}

	private Optional<String> checklists(TrelloCard card) {
		List<TrelloChecklist> checklists = card.checklistIds()
			.stream()
			.map(id -> plan.board().findChecklist(id))
			.flatMap(Optional::stream)
			.toList();
		if (checklists.isEmpty()) {
			return Optional.empty();
		}

		List<String> lines = new ArrayList<>();
		lines.add("## Checklists");
		for (TrelloChecklist checklist : checklists) {
			lines.add("### " + checklist.name());
			for (TrelloChecklist.CheckItem item : checklist.checkItems()) {
				lines.add((item.complete() ? "- [x] " : "- [ ] ") + item.name());
			}
		}
		return Optional.of(String.join("\n", lines));
	}

	/**
	 * Target label names for a card: labels mapped or created from the card's own labels,
	 * then the label of the card's list.
	 * @param card the card
	 * @return distinct label names
	 */
	public List<String> labels(TrelloCard card) {
		Set<String> names = new LinkedHashSet<>();
		Set<String> cardLabels = card.labels().stream().map(TrelloLabel::name).collect(Collectors.toSet());
		@Nullable
		String listLabel = null;

		for (ResolvedLabel label : plan.labels()) {
			switch (label.kind()) {
				case MAPPED -> {
					ResolvedLabel.Mapped mapped = (ResolvedLabel.Mapped) label;
					if (cardLabels.contains(mapped.source().name())) {
						names.add(mapped.target().name());
					}
				}
				case TO_CREATE -> {
					ResolvedLabel.ToCreate toCreate = (ResolvedLabel.ToCreate) label;
					if (cardLabels.contains(toCreate.source().name())) {
						names.add(toCreate.name());
					}
				}
				case LIST_MAPPED -> {
					ResolvedLabel.ListMapped listMapped = (ResolvedLabel.ListMapped) label;
					if (listLabel == null && listMapped.list().id().equals(card.listId())) {
						listLabel = listMapped.target().name();
					}
				}
				case SKIPPED, MISSING, MISSING_LIST -> {
				}
			}
		}

		if (listLabel != null) {
			names.add(listLabel);
		}
		return List.copyOf(names);
	}

	/**
	 * Logins of the card's members that map to verified GitHub users. Members without a
	 * verified mapping are dropped.
	 * @param card the card
	 * @return logins in card member order
	 */
	public List<String> assignees(TrelloCard card) {
		Set<String> logins = new LinkedHashSet<>();
		for (String memberId : card.memberIds()) {
			plan.board().findMember(memberId).flatMap(this::loginOf).ifPresent(logins::add);
		}
		return List.copyOf(logins);
	}

	/**
	 * Render the card's comments, oldest first.
	 * @param card the card
	 * @return one Markdown body per comment
	 */
	public List<String> comments(TrelloCard card) {
		return plan.board()
			.comments()
			.stream()
			.filter(comment -> comment.cardId().equals(card.id()))
			.sorted(Comparator.comparing(TrelloComment::date))
			.map(this::renderComment)
			.toList();
	}

	private String renderComment(TrelloComment comment) {
		String author = plan.board()
			.findMember(comment.memberId())
			.flatMap(this::loginOf)
			.map(login -> "@" + login)
			.orElse("`@" + comment.memberUsername() + "`");
		return "## " + author + " • " + COMMENT_DATE.format(comment.date()) + "\n" + comment.text();
	}

	private Optional<String> loginOf(TrelloMember member) {
		return plan.members()
			.stream()
			.filter(ResolvedMember.Verified.class::isInstance)
			.map(ResolvedMember.Verified.class::cast)
			.filter(verified -> member.isNamed(verified.sourceName()))
			.map(ResolvedMember.Verified::login)
			.findFirst();
	}

}

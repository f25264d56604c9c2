package org.springaicommunity.github.importer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builders for boards, mappings and target snapshots shared by the tests.
 */
final class Fixtures {

	static final RepositoryTarget REPO = new RepositoryTarget("acme", OwnerType.ORGANIZATION, "roadmap");

	private Fixtures() {
	}

	static TrelloList list(String id, String name) {
		return new TrelloList(id, name, false);
	}

	static TrelloList closedList(String id, String name) {
		return new TrelloList(id, name, true);
	}

	static TrelloLabel label(String name) {
		return new TrelloLabel("lbl-" + name, name, "green", 1);
	}

	static TrelloMember member(String id, String fullName, String username) {
		return new TrelloMember(id, fullName, username);
	}

	static TrelloCard card(String id, String name, String listId) {
		return new TrelloCard(id, name, "https://trello.com/c/" + id, false, "", List.of(), listId, List.of(),
				List.of(), List.of());
	}

	static TrelloCard closedCard(String id, String name, String listId) {
		return new TrelloCard(id, name, "https://trello.com/c/" + id, true, "", List.of(), listId, List.of(),
				List.of(), List.of());
	}

	static TrelloCard cardWithLabels(String id, String name, String listId, TrelloLabel... labels) {
		return new TrelloCard(id, name, "https://trello.com/c/" + id, false, "", List.of(), listId, List.of(),
				Arrays.asList(labels), List.of());
	}

	static TrelloComment comment(String id, String cardId, TrelloMember author, String text, String date) {
		return new TrelloComment(id, author.id(), author.username(), cardId, text, Instant.parse(date));
	}

	static GitHubLabel githubLabel(long id, String name) {
		return new GitHubLabel(id, name, "ededed", null);
	}

	static GitHubMilestone milestone(long id, long number, String title) {
		return new GitHubMilestone(id, number, title);
	}

	static GitHubUser user(long id, String login) {
		return new GitHubUser(id, login, null);
	}

	static StatusOption option(String id, String name) {
		return new StatusOption(id, name, "GRAY");
	}

	static ProjectInfo project(StatusOption... options) {
		return new ProjectInfo("PVT_1", 7, "Roadmap", "PVTSSF_status", "Status", Arrays.asList(options));
	}

	static ListRule statusRule(String list, String status) {
		return new ListRule(list, EntityReference.ofName(status), null, null, false);
	}

	static ValidationReport cleanReport() {
		return new ValidationReport(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
				List.of(), List.of(), List.of(), null);
	}

	static MigrationPlan plan(TrelloBoard board, List<ResolvedLabel> labels, List<ResolvedMember> members,
			Map<String, GitHubMilestone> milestones, Map<String, StatusOption> statuses, ProjectInfo project) {
		ImportMapping mapping = project != null ? mapping().project(project.number()).build() : mapping().build();
		return new MigrationPlan(mapping, board, project, labels, members, milestones, statuses, cleanReport());
	}

	static BoardBuilder board() {
		return new BoardBuilder();
	}

	static MappingBuilder mapping() {
		return new MappingBuilder();
	}

	static class BoardBuilder {

		private final List<TrelloList> lists = new ArrayList<>();

		private final List<TrelloMember> members = new ArrayList<>();

		private final List<TrelloComment> comments = new ArrayList<>();

		private final List<TrelloCard> cards = new ArrayList<>();

		private final List<TrelloLabel> labels = new ArrayList<>();

		private final List<TrelloChecklist> checklists = new ArrayList<>();

		BoardBuilder lists(TrelloList... values) {
			lists.addAll(Arrays.asList(values));
			return this;
		}

		BoardBuilder members(TrelloMember... values) {
			members.addAll(Arrays.asList(values));
			return this;
		}

		BoardBuilder comments(TrelloComment... values) {
			comments.addAll(Arrays.asList(values));
			return this;
		}

		BoardBuilder cards(TrelloCard... values) {
			cards.addAll(Arrays.asList(values));
			return this;
		}

		BoardBuilder labels(TrelloLabel... values) {
			labels.addAll(Arrays.asList(values));
			return this;
		}

		BoardBuilder checklists(TrelloChecklist... values) {
			checklists.addAll(Arrays.asList(values));
			return this;
		}

		TrelloBoard build() {
			return new TrelloBoard("Roadmap", lists, members, comments, cards, labels, checklists);
		}

	}

	static class MappingBuilder {

		private Integer project;

		private final List<LabelRule> labels = new ArrayList<>();

		private final List<UserRule> users = new ArrayList<>();

		private final List<ListRule> lists = new ArrayList<>();

		private final List<String> skipLists = new ArrayList<>();

		MappingBuilder project(int number) {
			this.project = number;
			return this;
		}

		MappingBuilder labels(LabelRule... values) {
			labels.addAll(Arrays.asList(values));
			return this;
		}

		MappingBuilder users(UserRule... values) {
			users.addAll(Arrays.asList(values));
			return this;
		}

		MappingBuilder lists(ListRule... values) {
			lists.addAll(Arrays.asList(values));
			return this;
		}

		MappingBuilder skip(String... values) {
			skipLists.addAll(Arrays.asList(values));
			return this;
		}

		ImportMapping build() {
			return new ImportMapping(REPO, project, labels, users, lists, skipLists);
		}

	}

}

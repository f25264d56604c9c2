package org.springaicommunity.github.importer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.importer.Fixtures.*;

@DisplayName("StatusSynchronizer Tests")
@ExtendWith(MockitoExtension.class)
class StatusSynchronizerTest {

	@Mock
	private GraphQLService graphQLService;

	private StatusSynchronizer synchronizer;

	private final StatusOption todoOption = option("opt-todo", "Todo");

	private final StatusOption doneOption = option("opt-done", "Done");

	private final ProjectInfo project = project(todoOption, doneOption);

	private MigrationPlan plan;

	@BeforeEach
	void setUp() {
		synchronizer = new StatusSynchronizer(graphQLService, new ImporterProperties());
		TrelloBoard board = board().lists(list("l-todo", "Todo"), list("l-done", "Done"), list("l-misc", "Misc"))
			.cards(card("c1", "Write docs", "l-done"), card("c2", "Fix login", "l-todo"),
					card("c3", "Misc work", "l-misc"))
			.build();
		plan = plan(board, List.of(), List.of(), Map.of(),
				Map.of("l-todo", todoOption, "l-done", doneOption), project);
	}

	@Test
	@DisplayName("Should update only items whose status differs from their card's list")
	void shouldUpdateDriftedItems() {
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, null)).thenReturn(new PageResult<>(List.of(
				new ProjectItem("item-1", 1, "Write docs", "Todo"), new ProjectItem("item-2", 2, "Fix login", "Todo"),
				new ProjectItem("item-3", 3, "Misc work", null), new ProjectItem("item-4", 4, "Unknown", null)),
				null, false));

		SyncResult result = synchronizer.synchronize(plan);

		assertThat(result).isEqualTo(new SyncResult(4, 1, 3));
		verify(graphQLService).setItemStatus(project, "item-1", doneOption);
		verify(graphQLService, times(1)).setItemStatus(any(), any(), any());
	}

	@Test
	@DisplayName("Should set a status on items that have none")
	void shouldSetMissingStatus() {
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, null))
			.thenReturn(new PageResult<>(List.of(new ProjectItem("item-2", 2, "Fix login", null)), null, false));

		SyncResult result = synchronizer.synchronize(plan);

		assertThat(result.updated()).isEqualTo(1);
		verify(graphQLService).setItemStatus(project, "item-2", todoOption);
	}

	@Test
	@DisplayName("Should follow the cursor until the last page")
	void shouldPageThroughItems() {
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, null))
			.thenReturn(new PageResult<>(List.of(new ProjectItem("item-1", 1, "Write docs", "Done")), "cursor-1", true));
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, "cursor-1"))
			.thenReturn(new PageResult<>(List.of(new ProjectItem("item-2", 2, "Fix login", "Done")), null, false));

		SyncResult result = synchronizer.synchronize(plan);

		assertThat(result).isEqualTo(new SyncResult(2, 1, 1));
		verify(graphQLService).setItemStatus(project, "item-2", todoOption);
	}

	@Test
	@DisplayName("Should issue no update on a second run against an unchanged project")
	void shouldBeIdempotent() {
		List<ProjectItem> items = new ArrayList<>(List.of(new ProjectItem("item-1", 1, "Write docs", "Todo"),
				new ProjectItem("item-2", 2, "Fix login", "Todo")));
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, null))
			.thenAnswer(invocation -> new PageResult<>(List.copyOf(items), null, false));
		when(graphQLService.setItemStatus(eq(project), anyString(), any())).thenAnswer(invocation -> {
			String itemId = invocation.getArgument(1);
			StatusOption option = invocation.getArgument(2);
			items.replaceAll(item -> item.id().equals(itemId)
					? new ProjectItem(item.id(), item.issueNumber(), item.issueTitle(), option.name()) : item);
			return option.name();
		});

		SyncResult first = synchronizer.synchronize(plan);
		SyncResult second = synchronizer.synchronize(plan);

		assertThat(first.updated()).isEqualTo(1);
		assertThat(second.updated()).isZero();
		verify(graphQLService, times(1)).setItemStatus(any(), any(), any());
	}

	@Test
	@DisplayName("Should use the first card when several share a title")
	void shouldUseFirstCardWithTitle() {
		TrelloBoard board = board().lists(list("l-todo", "Todo"), list("l-done", "Done"))
			.cards(card("c1", "Duplicate", "l-done"), card("c2", "Duplicate", "l-todo"))
			.build();
		MigrationPlan duplicates = plan(board, List.of(), List.of(), Map.of(),
				Map.of("l-todo", todoOption, "l-done", doneOption), project);
		when(graphQLService.listProjectItems(REPO, 7, "Status", 100, null))
			.thenReturn(new PageResult<>(List.of(new ProjectItem("item-1", 1, "Duplicate", "Done")), null, false));

		SyncResult result = synchronizer.synchronize(duplicates);

		assertThat(result.updated()).isZero();
		verify(graphQLService, never()).setItemStatus(any(), any(), any());
	}

	@Test
	@DisplayName("Should do nothing without a project or status mappings")
	void shouldSkipWithoutStatuses() {
		MigrationPlan noStatuses = plan(board().build(), List.of(), List.of(), Map.of(), Map.of(), project);

		assertThat(synchronizer.synchronize(noStatuses)).isEqualTo(SyncResult.none());
		verifyNoInteractions(graphQLService);
	}

}

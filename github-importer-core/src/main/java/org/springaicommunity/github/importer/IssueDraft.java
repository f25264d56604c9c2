package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Issue fields derived from one Trello card.
 *
 * @param title the issue title (the card name)
 * @param body the rendered issue body
 * @param labels names of the labels to apply
 * @param assignees logins to assign
 * @param milestone number of the milestone to assign, or {@code null}
 * @param comments rendered comments in chronological order
 */
public record IssueDraft(String title, String body, List<String> labels, List<String> assignees,
		@Nullable Long milestone, List<String> comments) {

	public IssueDraft {
		labels = List.copyOf(labels);
		assignees = List.copyOf(assignees);
		comments = List.copyOf(comments);
	}

}

package org.springaicommunity.github.importer;

import java.util.List;

/**
 * Identity of a target project and its status field.
 *
 * @param projectId the project's node ID
 * @param number the project number within its owner
 * @param title the project title
 * @param statusFieldId node ID of the status field
 * @param statusFieldName name of the status field
 * @param statusOptions current options of the status field
 */
public record ProjectInfo(String projectId, int number, String title, String statusFieldId,
		String statusFieldName, List<StatusOption> statusOptions) {

	public ProjectInfo {
		statusOptions = List.copyOf(statusOptions);
	}

}

package org.springaicommunity.github.importer;

/**
 * Signals that a label could not be created because the repository already has a label
 * with that name (HTTP 422 on label creation).
 */
public class LabelAlreadyExistsException extends GitHubHttpClient.GitHubApiException {

	private final String labelName;

	public LabelAlreadyExistsException(String labelName, String responseBody) {
		super("Label already exists: " + labelName, 422, responseBody);
		this.labelName = labelName;
	}

	public String getLabelName() {
		return labelName;
	}

}

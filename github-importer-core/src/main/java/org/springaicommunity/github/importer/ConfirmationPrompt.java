package org.springaicommunity.github.importer;

/**
 * Asks the operator whether to continue past a warning.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

	/**
	 * @param message the warning followed by the question
	 * @return true to continue, false to cancel the import
	 */
	boolean confirm(String message);

	/**
	 * A prompt that always continues, for unattended runs.
	 * @return the prompt
	 */
	static ConfirmationPrompt alwaysContinue() {
		return message -> true;
	}

}

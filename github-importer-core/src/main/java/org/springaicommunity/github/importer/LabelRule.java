package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * A {@code [[labels]]} entry of the mapping file.
 *
 * <p>
 * A lookup rule ({@code create = false}) resolves {@code github} against existing
 * repository labels by name or ID. A create rule names the label to create and may carry
 * a hex color.
 *
 * @param trello name of the Trello label
 * @param github target label reference
 * @param create whether the label is to be created
 * @param color optional hex color (3 or 6 digits, optional leading {@code #})
 */
public record LabelRule(String trello, EntityReference github, boolean create, @Nullable String color) {

	public LabelRule {
		if (create && github.isNumeric()) {
			throw new IllegalArgumentException("Label rule for '" + trello + "' creates a label and must name it");
		}
		if (!create && color != null) {
			throw new IllegalArgumentException("Label rule for '" + trello + "' sets a color without create = true");
		}
	}

	public static LabelRule lookup(String trello, EntityReference github) {
		return new LabelRule(trello, github, false, null);
	}

	public static LabelRule create(String trello, String github, @Nullable String color) {
		return new LabelRule(trello, EntityReference.ofName(github), true, color);
	}

}

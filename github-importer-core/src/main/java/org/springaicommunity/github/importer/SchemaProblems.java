package org.springaicommunity.github.importer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects schema violations found while reading an input document so they can be
 * reported together.
 */
final class SchemaProblems {

	private final List<String> messages = new ArrayList<>();

	void add(String message) {
		messages.add(message);
	}

	String text(JsonNode node, String field, String path) {
		JsonNode value = node.path(field);
		if (!value.isTextual()) {
			messages.add(path + "." + field + ": expected a string");
			return "";
		}
		return value.asText();
	}

	String nonEmptyText(JsonNode node, String field, String path) {
		String value = text(node, field, path);
		if (node.path(field).isTextual() && value.isEmpty()) {
			messages.add(path + "." + field + ": must not be empty");
		}
		return value;
	}

	boolean bool(JsonNode node, String field, String path) {
		JsonNode value = node.path(field);
		if (!value.isBoolean()) {
			messages.add(path + "." + field + ": expected a boolean");
			return false;
		}
		return value.asBoolean();
	}

	boolean optionalBool(JsonNode node, String field, String path) {
		if (node.path(field).isMissingNode()) {
			return false;
		}
		return bool(node, field, path);
	}

	void throwIfAny(String summary) {
		if (!messages.isEmpty()) {
			throw new IllegalArgumentException(summary + ":\n  - " + String.join("\n  - ", messages));
		}
	}

}

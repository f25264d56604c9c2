package org.springaicommunity.github.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Reads a Trello board export (the JSON served at {@code https://trello.com/b/<id>.json})
 * into a {@link TrelloBoard}.
 *
 * <p>
 * All schema violations found in the document are reported together in one
 * {@link IllegalArgumentException}. Actions other than {@code commentCard} are ignored.
 */
public class BoardReader {

	private static final Logger logger = LoggerFactory.getLogger(BoardReader.class);

	private final ObjectMapper objectMapper;

	public BoardReader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public TrelloBoard readFile(Path path) throws IOException {
		logger.debug("Reading Trello export from {}", path);
		try (InputStream in = Files.newInputStream(path)) {
			return read(in);
		}
	}

	/**
	 * Download and read a board export.
	 * @param url board URL
	 * @return the board
	 * @throws IOException if the download fails or returns a non-2xx status
	 */
	public TrelloBoard readUrl(URI url) throws IOException {
		logger.debug("Fetching Trello board from {}", url);
		HttpClient client = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
		HttpRequest request = HttpRequest.newBuilder().uri(url).header("Accept", "application/json").GET().build();
		try {
			HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
			try (InputStream body = response.body()) {
				if (response.statusCode() < 200 || response.statusCode() >= 300) {
					throw new IOException("HTTP error fetching Trello board [" + response.statusCode() + "]: "
							+ new String(body.readAllBytes(), StandardCharsets.UTF_8));
				}
				return read(body);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while fetching " + url, e);
		}
	}

	public TrelloBoard read(InputStream in) throws IOException {
		return read(objectMapper.readTree(in));
	}

	public TrelloBoard read(JsonNode root) {
		SchemaProblems problems = new SchemaProblems();
		if (!root.isObject()) {
			throw new IllegalArgumentException("Trello export must be a JSON object");
		}

		String name = problems.text(root, "name", "board");
		List<TrelloList> lists = readArray(root, "lists", "", problems,
				(node, path) -> new TrelloList(problems.text(node, "id", path), problems.text(node, "name", path),
						problems.bool(node, "closed", path)));
		List<TrelloMember> members = readArray(root, "members", "", problems,
				(node, path) -> new TrelloMember(problems.text(node, "id", path),
						problems.text(node, "fullName", path), problems.text(node, "username", path)));
		List<TrelloLabel> labels = readArray(root, "labels", "", problems, (node, path) -> readLabel(node, path, problems));
		List<TrelloChecklist> checklists = readArray(root, "checklists", "", problems,
				(node, path) -> new TrelloChecklist(problems.text(node, "id", path), problems.text(node, "name", path),
						problems.text(node, "idCard", path),
						readArray(node, "checkItems", path, problems, (item, itemPath) -> readCheckItem(item, itemPath,
								problems))));
		List<TrelloCard> cards = readArray(root, "cards", "", problems, (node, path) -> readCard(node, path, problems));

		List<TrelloComment> comments = new ArrayList<>();
		JsonNode actions = root.path("actions");
		if (!actions.isArray()) {
			problems.add("actions: expected an array");
		}
		else {
			for (int i = 0; i < actions.size(); i++) {
				JsonNode action = actions.get(i);
				if ("commentCard".equals(action.path("type").asText(null))) {
					comments.add(readComment(action, "actions[" + i + "]", problems));
				}
			}
		}

		problems.throwIfAny("Failed to parse Trello export");
		logger.debug("Read board '{}': {} lists, {} cards, {} labels, {} comments", name, lists.size(), cards.size(),
				labels.size(), comments.size());
		return new TrelloBoard(name, lists, members, comments, cards, labels, checklists);
	}

	private TrelloLabel readLabel(JsonNode node, String path, SchemaProblems problems) {
		return new TrelloLabel(problems.text(node, "id", path), problems.text(node, "name", path),
				node.path("color").asText(""), node.path("uses").asInt(0));
	}

	private TrelloChecklist.CheckItem readCheckItem(JsonNode node, String path, SchemaProblems problems) {
		String state = problems.text(node, "state", path);
		if (!state.isEmpty() && !"complete".equals(state) && !"incomplete".equals(state)) {
			problems.add(path + ".state: expected 'complete' or 'incomplete' but was '" + state + "'");
		}
		return new TrelloChecklist.CheckItem(problems.text(node, "id", path), problems.text(node, "name", path),
				"complete".equals(state));
	}

	private TrelloCard readCard(JsonNode node, String path, SchemaProblems problems) {
		return new TrelloCard(problems.text(node, "id", path), problems.text(node, "name", path),
				problems.text(node, "url", path), problems.bool(node, "closed", path),
				problems.text(node, "desc", path), readStrings(node, "idChecklists", path, problems),
				problems.text(node, "idList", path), readStrings(node, "idMembers", path, problems),
				readArray(node, "labels", path, problems, (label, labelPath) -> readLabel(label, labelPath, problems)),
				readArray(node, "attachments", path, problems,
						(attachment, attachmentPath) -> new TrelloAttachment(
								problems.text(attachment, "id", attachmentPath),
								problems.text(attachment, "name", attachmentPath),
								problems.text(attachment, "url", attachmentPath))));
	}

	private TrelloComment readComment(JsonNode node, String path, SchemaProblems problems) {
		JsonNode creator = node.path("memberCreator");
		JsonNode data = node.path("data");
		String rawDate = problems.text(node, "date", path);
		Instant date = Instant.EPOCH;
		try {
			if (!rawDate.isEmpty()) {
				date = Instant.parse(rawDate);
			}
		}
		catch (DateTimeParseException e) {
			problems.add(path + ".date: not an ISO-8601 instant: " + rawDate);
		}
		return new TrelloComment(problems.text(node, "id", path), problems.text(creator, "id", path + ".memberCreator"),
				problems.text(creator, "username", path + ".memberCreator"),
				problems.text(data, "idCard", path + ".data"), problems.text(data, "text", path + ".data"), date);
	}

	private List<String> readStrings(JsonNode node, String field, String path, SchemaProblems problems) {
		List<String> values = new ArrayList<>();
		JsonNode array = node.path(field);
		if (!array.isArray()) {
			problems.add(path + "." + field + ": expected an array");
			return values;
		}
		for (JsonNode value : array) {
			values.add(value.asText());
		}
		return values;
	}

	private <T> List<T> readArray(JsonNode parent, String field, String parentPath, SchemaProblems problems,
			BiFunction<JsonNode, String, T> reader) {
		List<T> result = new ArrayList<>();
		String path = parentPath.isEmpty() ? field : parentPath + "." + field;
		JsonNode array = parent.path(field);
		if (!array.isArray()) {
			problems.add(path + ": expected an array");
			return result;
		}
		for (int i = 0; i < array.size(); i++) {
			result.add(reader.apply(array.get(i), path + "[" + i + "]"));
		}
		return result;
	}

}

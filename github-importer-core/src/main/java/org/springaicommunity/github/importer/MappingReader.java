package org.springaicommunity.github.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a {@code map.toml} mapping file into an {@link ImportMapping}.
 *
 * <p>
 * Example:
 *
 * <pre>
 * project = 3
 *
 * [repo]
 * owner = { type = "organization", login = "acme" }
 * repo = "roadmap"
 *
 * [[labels]]
 * trello = "Bug"
 * github = "bug"
 *
 * [[labels]]
 * trello = "Design"
 * github = "design"
 * create = true
 * color = "#c5def5"
 *
 * [[users]]
 * trello = "@jdoe"
 * github = "@jdoe-gh"
 *
 * [[lists]]
 * list = "Done"
 * status = "Done"
 * milestone = "v1.0"
 *
 * [skip]
 * lists = ["Ideas"]
 * </pre>
 *
 * <p>
 * All schema violations are reported together in one {@link IllegalArgumentException}.
 */
public class MappingReader {

	private static final Logger logger = LoggerFactory.getLogger(MappingReader.class);

	private static final Pattern HEX_COLOR = Pattern.compile("^#?([0-9a-f]{6}|[0-9a-f]{3})$",
			Pattern.CASE_INSENSITIVE);

	private final ObjectMapper tomlMapper;

	public MappingReader() {
		this(ObjectMapperFactory.createToml());
	}

	public MappingReader(ObjectMapper tomlMapper) {
		this.tomlMapper = tomlMapper;
	}

	public ImportMapping readFile(Path path) throws IOException {
		logger.debug("Reading mapping from {}", path);
		return read(Files.readString(path));
	}

	public ImportMapping read(String toml) throws IOException {
		return read(tomlMapper.readTree(toml));
	}

	public ImportMapping read(JsonNode root) {
		SchemaProblems problems = new SchemaProblems();

		RepositoryTarget repo = readRepo(root.path("repo"), problems);

		Integer project = null;
		JsonNode projectNode = root.path("project");
		if (!projectNode.isMissingNode()) {
			if (projectNode.isIntegralNumber() && projectNode.asInt() > 0) {
				project = projectNode.asInt();
			}
			else {
				problems.add("project: expected a positive integer");
			}
		}

		List<LabelRule> labels = new ArrayList<>();
		for (Indexed entry : tables(root, "labels", problems)) {
			LabelRule rule = readLabelRule(entry.node(), entry.path(), problems);
			if (rule != null) {
				labels.add(rule);
			}
		}

		List<UserRule> users = new ArrayList<>();
		for (Indexed entry : tables(root, "users", problems)) {
			users.add(new UserRule(stripAt(problems.nonEmptyText(entry.node(), "trello", entry.path())),
					stripAt(problems.nonEmptyText(entry.node(), "github", entry.path()))));
		}

		List<ListRule> lists = new ArrayList<>();
		for (Indexed entry : tables(root, "lists", problems)) {
			JsonNode node = entry.node();
			String path = entry.path();
			lists.add(new ListRule(problems.nonEmptyText(node, "list", path),
					readReference(node, "status", path, problems), readReference(node, "label", path, problems),
					readReference(node, "milestone", path, problems), problems.optionalBool(node, "create", path)));
		}

		List<String> skipLists = new ArrayList<>();
		JsonNode skip = root.path("skip").path("lists");
		if (!skip.isMissingNode()) {
			if (!skip.isArray()) {
				problems.add("skip.lists: expected an array");
			}
			else {
				for (int i = 0; i < skip.size(); i++) {
					JsonNode value = skip.get(i);
					if (!value.isTextual() || value.asText().isEmpty()) {
						problems.add("skip.lists[" + i + "]: expected a non-empty string");
					}
					else {
						skipLists.add(value.asText());
					}
				}
			}
		}

		problems.throwIfAny("Failed to parse map file");
		logger.debug("Read mapping for {}: {} label rules, {} user rules, {} list rules, {} skipped lists",
				repo.fullName(), labels.size(), users.size(), lists.size(), skipLists.size());
		return new ImportMapping(repo, project, labels, users, lists, skipLists);
	}

	private RepositoryTarget readRepo(JsonNode repo, SchemaProblems problems) {
		if (!repo.isObject()) {
			problems.add("repo: expected a table");
			return new RepositoryTarget("", OwnerType.USER, "");
		}
		String repoName = problems.nonEmptyText(repo, "repo", "repo");
		JsonNode owner = repo.path("owner");
		if (owner.isTextual()) {
			if (owner.asText().isEmpty()) {
				problems.add("repo.owner: must not be empty");
			}
			return new RepositoryTarget(owner.asText(), OwnerType.USER, repoName);
		}
		if (owner.isObject()) {
			String login = problems.nonEmptyText(owner, "login", "repo.owner");
			String type = problems.text(owner, "type", "repo.owner");
			OwnerType ownerType = OwnerType.USER;
			if ("organization".equals(type)) {
				ownerType = OwnerType.ORGANIZATION;
			}
			else if (!"user".equals(type) && owner.path("type").isTextual()) {
				problems.add("repo.owner.type: expected 'organization' or 'user' but was '" + type + "'");
			}
			return new RepositoryTarget(login, ownerType, repoName);
		}
		problems.add("repo.owner: expected a login or a table with type and login");
		return new RepositoryTarget("", OwnerType.USER, repoName);
	}

	private @Nullable LabelRule readLabelRule(JsonNode node, String path, SchemaProblems problems) {
		String trello = problems.nonEmptyText(node, "trello", path);
		boolean create = problems.optionalBool(node, "create", path);
		EntityReference github = readReference(node, "github", path, problems);
		if (github == null) {
			problems.add(path + ".github: required");
			return null;
		}
		if (!create) {
			return LabelRule.lookup(trello, github);
		}
		if (github.isNumeric()) {
			problems.add(path + ".github: must be a label name when create = true");
			return null;
		}

		String color = null;
		JsonNode colorNode = node.path("color");
		if (!colorNode.isMissingNode()) {
			if (!colorNode.isTextual() || !HEX_COLOR.matcher(colorNode.asText()).matches()) {
				problems.add(path + ".color: expected a hex color such as #d73a4a or fff");
			}
			else {
				color = colorNode.asText().toLowerCase(Locale.ROOT);
			}
		}
		return LabelRule.create(trello, github.requireName(), color);
	}

	private @Nullable EntityReference readReference(JsonNode node, String field, String path,
			SchemaProblems problems) {
		JsonNode value = node.path(field);
		if (value.isMissingNode()) {
			return null;
		}
		if (value.isIntegralNumber()) {
			return EntityReference.ofId(value.asLong());
		}
		if (value.isTextual() && !value.asText().isEmpty()) {
			return EntityReference.ofName(value.asText());
		}
		problems.add(path + "." + field + ": expected an integer ID or a non-empty name");
		return null;
	}

	private List<Indexed> tables(JsonNode root, String field, SchemaProblems problems) {
		List<Indexed> result = new ArrayList<>();
		JsonNode array = root.path(field);
		if (array.isMissingNode()) {
			return result;
		}
		if (!array.isArray()) {
			problems.add(field + ": expected an array of tables");
			return result;
		}
		for (int i = 0; i < array.size(); i++) {
			result.add(new Indexed(array.get(i), field + "[" + i + "]"));
		}
		return result;
	}

	private static String stripAt(String name) {
		return name.startsWith("@") ? name.substring(1) : name;
	}

	private record Indexed(JsonNode node, String path) {
	}

}

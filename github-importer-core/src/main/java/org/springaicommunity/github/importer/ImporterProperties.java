package org.springaicommunity.github.importer;

/**
 * Configuration properties for the importer.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitHubImporterBuilder}.
 * The defaults target github.com and are suitable for most use cases.
 */
public class ImporterProperties {

	/**
	 * Base URL of the GitHub REST API.
	 */
	private String apiBaseUrl = "https://api.github.com";

	/**
	 * Endpoint of the GitHub GraphQL API.
	 */
	private String graphQLEndpoint = "https://api.github.com/graphql";

	/**
	 * Value of the {@code X-GitHub-Api-Version} header sent with REST calls.
	 */
	private String apiVersion = "2022-11-28";

	/**
	 * User agent sent with every request.
	 */
	private String userAgent = "github-importer";

	/**
	 * Number of project items requested per GraphQL page.
	 */
	private int projectItemsPageSize = 100;

	/**
	 * Name of the single-select project field holding the workflow column.
	 */
	private String statusFieldName = "Status";

	/**
	 * Mapping file used when none is given on the command line.
	 */
	private String defaultMapFile = "map.toml";

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public String getGraphQLEndpoint() {
		return graphQLEndpoint;
	}

	public void setGraphQLEndpoint(String graphQLEndpoint) {
		this.graphQLEndpoint = graphQLEndpoint;
	}

	public String getApiVersion() {
		return apiVersion;
	}

	public void setApiVersion(String apiVersion) {
		this.apiVersion = apiVersion;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public int getProjectItemsPageSize() {
		return projectItemsPageSize;
	}

	/**
	 * Sets the GraphQL page size used when reading project items.
	 * @param projectItemsPageSize page size between 1 and 100
	 */
	public void setProjectItemsPageSize(int projectItemsPageSize) {
		if (projectItemsPageSize < 1 || projectItemsPageSize > 100) {
			throw new IllegalArgumentException("Project item page size must be between 1 and 100");
		}
		this.projectItemsPageSize = projectItemsPageSize;
	}

	public String getStatusFieldName() {
		return statusFieldName;
	}

	public void setStatusFieldName(String statusFieldName) {
		this.statusFieldName = statusFieldName;
	}

	public String getDefaultMapFile() {
		return defaultMapFile;
	}

	public void setDefaultMapFile(String defaultMapFile) {
		this.defaultMapFile = defaultMapFile;
	}

}

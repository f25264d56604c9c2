package org.springaicommunity.github.importer;

/**
 * Kind of account owning the target repository and project.
 */
public enum OwnerType {

	USER("user", "users"), ORGANIZATION("organization", "orgs");

	private final String graphQLField;

	private final String urlSegment;

	OwnerType(String graphQLField, String urlSegment) {
		this.graphQLField = graphQLField;
		this.urlSegment = urlSegment;
	}

	/**
	 * Root query field used to look up projects of this owner kind.
	 * @return "user" or "organization"
	 */
	public String graphQLField() {
		return graphQLField;
	}

	/**
	 * Path segment used in github.com URLs for this owner kind.
	 * @return "users" or "orgs"
	 */
	public String urlSegment() {
		return urlSegment;
	}

}

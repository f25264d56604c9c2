package org.springaicommunity.github.importer;

/**
 * The repository issues are imported into.
 *
 * @param owner login of the owning user or organization
 * @param ownerType kind of the owning account
 * @param repo repository name
 */
public record RepositoryTarget(String owner, OwnerType ownerType, String repo) {

	public String fullName() {
		return owner + "/" + repo;
	}

	/**
	 * REST path prefix for this repository.
	 * @return path such as {@code /repos/owner/repo}
	 */
	public String apiPath() {
		return "/repos/" + owner + "/" + repo;
	}

}

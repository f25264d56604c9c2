package org.springaicommunity.github.importer;

/**
 * A milestone of the target repository.
 *
 * @param id the milestone's database ID
 * @param number the milestone number used when assigning it to issues
 * @param title the milestone title
 */
public record GitHubMilestone(long id, long number, String title) implements Identifiable {

	@Override
	public String name() {
		return title;
	}

	@Override
	public Long numericId() {
		return id;
	}

	@Override
	public Long secondaryId() {
		return number;
	}

}

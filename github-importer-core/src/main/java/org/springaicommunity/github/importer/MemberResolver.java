package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that every GitHub login named by a user rule exists.
 */
public class MemberResolver {

	private static final Logger logger = LoggerFactory.getLogger(MemberResolver.class);

	private final RestService restService;

	public MemberResolver(RestService restService) {
		this.restService = restService;
	}

	public List<ResolvedMember> resolve(List<UserRule> rules) {
		List<ResolvedMember> members = new ArrayList<>();
		for (UserRule rule : rules) {
			Optional<GitHubUser> user = restService.findUser(rule.github());
			if (user.isPresent()) {
				members.add(new ResolvedMember.Verified(rule.trello(), user.get()));
			}
			else {
				logger.debug("GitHub user {} mapped from {} does not exist", rule.github(), rule.trello());
				members.add(new ResolvedMember.Unverified(rule.trello(), rule.github()));
			}
		}
		return members;
	}

}

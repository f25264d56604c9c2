package org.springaicommunity.github.importer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies every Trello label, and every list rule carrying a label reference, into a
 * {@link ResolvedLabel}.
 */
public class LabelResolver {

	/**
	 * @param sourceLabels labels defined on the board
	 * @param rules label rules of the mapping
	 * @param listRules list rules whose list resolved
	 * @param targetLabels labels of the target repository
	 * @return one entry per source label followed by one entry per list label rule
	 */
	public List<ResolvedLabel> resolve(List<TrelloLabel> sourceLabels, List<LabelRule> rules,
			List<ResolvedListRule> listRules, List<GitHubLabel> targetLabels) {
		List<ResolvedLabel> resolved = new ArrayList<>();

		for (TrelloLabel source : sourceLabels) {
			resolved.add(resolveSourceLabel(source, rules, targetLabels));
		}

		for (ResolvedListRule listRule : listRules) {
			EntityReference reference = listRule.rule().label();
			if (reference == null) {
				continue;
			}
			Optional<GitHubLabel> target = IdentityMatcher.find(reference, targetLabels);
			if (target.isPresent()) {
				resolved.add(new ResolvedLabel.ListMapped(listRule.list(), target.get()));
			}
			else {
				resolved.add(new ResolvedLabel.MissingList(listRule.list(), reference));
			}
		}

		return resolved;
	}

	private ResolvedLabel resolveSourceLabel(TrelloLabel source, List<LabelRule> rules,
			List<GitHubLabel> targetLabels) {
		Optional<LabelRule> rule = rules.stream().filter(r -> r.trello().equals(source.name())).findFirst();
		if (rule.isEmpty()) {
			return new ResolvedLabel.Skipped(source);
		}
		LabelRule labelRule = rule.get();
		if (labelRule.create()) {
			return new ResolvedLabel.ToCreate(source, labelRule.github().requireName(), labelRule.color());
		}
		return IdentityMatcher.find(labelRule.github(), targetLabels)
			.<ResolvedLabel>map(target -> new ResolvedLabel.Mapped(source, target))
			.orElseGet(() -> new ResolvedLabel.Missing(source, labelRule.github()));
	}

}

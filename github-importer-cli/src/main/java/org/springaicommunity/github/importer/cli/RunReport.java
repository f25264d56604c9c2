package org.springaicommunity.github.importer.cli;

import java.util.List;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.importer.ImportOutcome;
import org.springaicommunity.github.importer.ImportSummary;
import org.springaicommunity.github.importer.ValidationReport;

/**
 * JSON document written by {@code --report}.
 *
 * @param outcome the outcome kind
 * @param problems validation problems, empty unless rejected
 * @param warnings validation warnings
 * @param cardCount cards that would be imported, set for dry runs
 * @param reason why the run was cancelled, set when cancelled
 * @param summary what was written, set when completed
 */
public record RunReport(ImportOutcome.Kind outcome, List<ValidationReport.Problem> problems, List<String> warnings,
		@Nullable Integer cardCount, @Nullable String reason, @Nullable ImportSummary summary) {

	public static RunReport of(ImportOutcome outcome) {
		return switch (outcome.kind()) {
			case REJECTED -> {
				ValidationReport report = ((ImportOutcome.Rejected) outcome).report();
				yield new RunReport(outcome.kind(), report.problems(), report.warnings(), null, null, null);
			}
			case CANCELLED -> new RunReport(outcome.kind(), List.of(), List.of(), null,
					((ImportOutcome.Cancelled) outcome).reason(), null);
			case DRY_RUN -> {
				ImportOutcome.DryRun dryRun = (ImportOutcome.DryRun) outcome;
				yield new RunReport(outcome.kind(), List.of(), dryRun.report().warnings(), dryRun.cardCount(), null,
						null);
			}
			case COMPLETED -> new RunReport(outcome.kind(), List.of(), List.of(), null, null,
					((ImportOutcome.Completed) outcome).summary());
		};
	}

}

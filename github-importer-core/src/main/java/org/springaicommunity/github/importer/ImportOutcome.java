package org.springaicommunity.github.importer;

/**
 * Result of {@link BoardImportService#planAndRun}.
 */
public sealed interface ImportOutcome {

	enum Kind {

		REJECTED, CANCELLED, DRY_RUN, COMPLETED

	}

	Kind kind();

	/**
	 * The plan is invalid. Nothing was written.
	 */
	record Rejected(ValidationReport report) implements ImportOutcome {

		@Override
		public Kind kind() {
			return Kind.REJECTED;
		}

	}

	/**
	 * The operator declined a warning. Nothing was written.
	 */
	record Cancelled(String reason) implements ImportOutcome {

		@Override
		public Kind kind() {
			return Kind.CANCELLED;
		}

	}

	/**
	 * The plan is valid and the run stopped before writing, as requested.
	 * @param report the validation report, possibly with warnings
	 * @param cardCount cards that would become issues
	 * @param labelsToCreate labels that would be created
	 */
	record DryRun(ValidationReport report, int cardCount, int labelsToCreate) implements ImportOutcome {

		@Override
		public Kind kind() {
			return Kind.DRY_RUN;
		}

	}

	record Completed(ImportSummary summary) implements ImportOutcome {

		@Override
		public Kind kind() {
			return Kind.COMPLETED;
		}

	}

}

package org.springaicommunity.github.importer;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Inputs
	public String mapFile;

	public @Nullable String trelloExport = null;

	public @Nullable String trelloUrl = null;

	public @Nullable String githubToken = null;

	// Card selection
	public boolean keepClosed = false;

	public boolean keepClosedLists = false;

	// Mode flags
	public boolean dryRun = false;

	public boolean assumeYes = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Output
	public @Nullable String reportFile = null;

	public ParsedConfiguration(ImporterProperties defaultProperties) {
		this.mapFile = defaultProperties.getDefaultMapFile();
	}

	public ImportOptions toImportOptions() {
		return new ImportOptions(keepClosed, keepClosedLists, dryRun);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "mapFile='" + mapFile + '\'' + ", trelloExport='" + trelloExport + '\''
				+ ", trelloUrl='" + trelloUrl + '\'' + ", githubToken=" + (githubToken != null ? "***" : "null")
				+ ", keepClosed=" + keepClosed + ", keepClosedLists=" + keepClosedLists + ", dryRun=" + dryRun
				+ ", assumeYes=" + assumeYes + ", verbose=" + verbose + ", helpRequested=" + helpRequested
				+ ", reportFile='" + reportFile + '\'' + '}';
	}

}

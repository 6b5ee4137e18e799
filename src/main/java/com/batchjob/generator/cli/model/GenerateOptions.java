package com.batchjob.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--input", "-i" }, required = true, description = "Job description file to transform")
	private Path input;

	@Option(names = { "--output",
			"-o" }, description = "Generated script path (defaults to <input dir>/generated/<input file name>)")
	private Path output;

	@Option(names = {
			"--start-phase" }, defaultValue = "0", description = "First phase number, 0 for the default of 10")
	private int startPhase;

	@Option(names = { "--date" }, description = "Date written in the header (defaults to today, dd/MM/yyyy)")
	private String date;

	@Option(names = { "--user" }, description = "User written in the header (defaults to %%USERNAME%%)")
	private String user;

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Source charset")
	private String encoding;

	@Option(names = {
			"--fallback-encoding" }, defaultValue = "windows-1252", description = "Charset retried when the source does not decode")
	private String fallbackEncoding;

	@Option(names = { "--output-encoding" }, defaultValue = "UTF-8", description = "Charset of the generated script")
	private String outputEncoding;

	@Option(names = { "--crlf" }, description = "Write CRLF line endings instead of LF")
	private boolean crlf;

	@Option(names = {
			"--strip-comments" }, description = "Drop plain comments with fewer than two hyphens")
	private boolean stripComments;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing generated script")
	private boolean force;

	@Option(names = { "--validate" }, description = "Run the structural validator on the generated script")
	private boolean validate;

	@Option(names = { "--verbose", "-v" }, description = "Debug logging")
	private boolean verbose;

	// ---- Getters only; picocli sets fields reflectively ----
}

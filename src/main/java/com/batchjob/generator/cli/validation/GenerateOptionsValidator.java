package com.batchjob.generator.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.batchjob.generator.cli.exception.OptionsValidationException;
import com.batchjob.generator.cli.model.GenerateOptions;
import com.batchjob.generator.cli.model.OptionError;
import com.batchjob.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	static final String GENERATED_DIR = "generated";
	private static final String FORBIDDEN_NAME_CHARS = "/\\:*?\"<>|";
	private static final int MIN_JOB_NAME_LENGTH = 5;
	private static final String INPUT_OPTION = "--input";
	private static final String OUTPUT_OPTION = "--output";

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<OptionError> errors = new ArrayList<>();

		Path input = o.getInput() == null ? null : o.getInput().toAbsolutePath().normalize();
		if (input == null) {
			errors.add(new OptionError(INPUT_OPTION, "Input file is required (--input / -i)."));
		} else if (!Files.isRegularFile(input)) {
			errors.add(new OptionError(INPUT_OPTION, "Input file does not exist or is not a regular file: " + input));
		}

		if (o.getStartPhase() < 0) {
			errors.add(new OptionError("--start-phase", "Start phase must be >= 0. Got: " + o.getStartPhase()));
		}

		Charset inputCharset = parseCharset("--encoding", o.getEncoding(), errors);
		Charset fallbackCharset = parseCharset("--fallback-encoding", o.getFallbackEncoding(), errors);
		Charset outputCharset = parseCharset("--output-encoding", o.getOutputEncoding(), errors);

		Path output = resolveOutput(o, input);
		if (output != null) {
			List<String> nameErrors = new ArrayList<>();
			validateJobName(output.getFileName().toString(), nameErrors);
			nameErrors.forEach(m -> errors.add(new OptionError(OUTPUT_OPTION, m)));
			if (output.equals(input)) {
				errors.add(new OptionError(OUTPUT_OPTION, "Output must differ from input: " + output));
			}
			if (Files.exists(output) && !o.isForce()) {
				errors.add(new OptionError(OUTPUT_OPTION, "Output file already exists: " + output + ". Use --force to overwrite."));
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(input, output, inputCharset, fallbackCharset, outputCharset);
	}

	/**
	 * Job names follow the scheduler's rules: a .bat or .cmd file name of at least five
	 * characters without path separators or wildcards.
	 */
	public static void validateJobName(String name, List<String> errors) {
		if (isBlank(name)) {
			errors.add("Job name must not be empty.");
			return;
		}
		String lower = name.toLowerCase(Locale.ROOT);
		if (!lower.endsWith(".bat") && !lower.endsWith(".cmd")) {
			errors.add("Job name must end with .bat or .cmd: " + name);
		}
		if (name.chars().anyMatch(c -> FORBIDDEN_NAME_CHARS.indexOf(c) >= 0)) {
			errors.add("Job name contains forbidden characters: " + name);
		}
		if (name.length() < MIN_JOB_NAME_LENGTH) {
			errors.add("Job name is too short (minimum " + MIN_JOB_NAME_LENGTH + " characters): " + name);
		}
	}

	private static Path resolveOutput(GenerateOptions o, Path input) {
		if (o.getOutput() != null) {
			return o.getOutput().toAbsolutePath().normalize();
		}
		if (input == null || input.getParent() == null) {
			return null;
		}
		return input.getParent().resolve(GENERATED_DIR).resolve(input.getFileName());
	}

	private static Charset parseCharset(String option, String name, List<OptionError> errors) {
		try {
			return Charset.forName(name);
		} catch (IllegalArgumentException e) {
			errors.add(new OptionError(option, "Unsupported charset: " + name));
			return null;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}

package com.batchjob.generator.cli.exception;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.batchjob.generator.cli.model.OptionError;

/**
 * Every option problem found in one validation pass, so the operator can fix them all at once.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<OptionError> optionErrors;

    public OptionsValidationException(List<OptionError> optionErrors) {
        super(describe(optionErrors));
        this.optionErrors = List.copyOf(optionErrors);
    }

    public List<OptionError> getOptionErrors() {
        return optionErrors;
    }

    /**
     * Options that were rejected, in the order they were checked.
     */
    public Set<String> getRejectedOptions() {
        Set<String> options = new LinkedHashSet<>();
        optionErrors.forEach(e -> options.add(e.getOption()));
        return options;
    }

    private static String describe(List<OptionError> errors) {
        StringBuilder sb = new StringBuilder();
        for (OptionError error : errors) {
            if (sb.length() > 0) {
                sb.append(System.lineSeparator());
            }
            sb.append(error);
        }
        return sb.toString();
    }
}

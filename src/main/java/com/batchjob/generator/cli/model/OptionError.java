package com.batchjob.generator.cli.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One rejected option value: the option as typed on the command line and why it was refused.
 */
@Value
public class OptionError {

    @NonNull
    String option;

    @NonNull
    String message;

    @Override
    public String toString() {
        return option + ": " + message;
    }
}

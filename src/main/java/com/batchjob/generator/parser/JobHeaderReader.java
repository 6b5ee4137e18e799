package com.batchjob.generator.parser;

import com.batchjob.generator.codegen.exception.InputUnavailableException;
import com.batchjob.generator.codegen.exception.MissingJobNameException;
import com.batchjob.generator.codegen.model.input.JobHeader;
import com.batchjob.generator.codegen.model.input.SourceLine;

/**
 * Reads job name, author, title and description from the head of a source.
 * Only the job name is mandatory; the other three fall back to defaults.
 */
public class JobHeaderReader {

    public JobHeader read(SourceCursor cursor) throws InputUnavailableException, MissingJobNameException {
        String jobFileName = cursor.next()
                .map(SourceLine::getText)
                .orElseThrow(() -> new MissingJobNameException(cursor.getSourceName()));

        JobHeader.JobHeaderBuilder builder = JobHeader.builder().jobFileName(jobFileName);
        cursor.next().ifPresent(line -> builder.author(line.getText()));
        cursor.next().ifPresent(line -> builder.title(line.getText()));
        cursor.next().ifPresent(line -> builder.description(line.getText()));
        return builder.build();
    }
}

package com.batchjob.generator.classify;

import java.util.List;

/**
 * Literal markers of the legacy command vocabulary.
 */
public final class CommandVocabulary {

    private CommandVocabulary() {
        // constants only
    }

    /** Processing root of managed programs. */
    public static final String PROCESSING_ROOT = "%FM_PROG%";

    /** Root of the external unix-like executables. */
    public static final String EXTERNAL_TOOL_ROOT = "%PF_EXE";

    /** Messaging engine marker. */
    public static final String NOTIFIER_ROOT = "%PERL%";

    public static final String FILE_ENUMERATION = "forfiles";

    public static final List<String> LOOP_PREFIXES = List.of("for ", "for%%");

    public static final List<String> SIMPLE_DIRECTIVES = List.of(
            "if", ":", "goto", "set", "type", "mkdir",
            "rmdir", "echo", "find", "ping", "dir");

    public static final String CALL_KEYWORD = "call";

    /** Absolute path fragment of the external binaries folder. */
    public static final String PROGRAM_FILES = "program files";

    public static final List<String> FILE_MOVE_VERBS = List.of("move", "copy");

    public static final String DELETE_KEYWORD = "del";

    public static final List<String> RETRYABLE_COMMANDS = List.of("dbcheck", "dchain", "keybuild", "pexport");

    /** Retryable command that must not have its output journaled. */
    public static final String UNJOURNALED_RETRYABLE = "pexport";

    public static final String PIMPORT = "pimport";

    public static final String SEND_MAIL = "sendmail";

    /** Commands whose presence in a phase marker resets the error counter. */
    public static final List<String> ERROR_COUNTER_COMMANDS = List.of(
            "sort", "ls", "wc", "keybuild", "dbcheck", "dchain",
            "export", "pexport", "mail", "cat", "uniq", "grep",
            "join", "sed", "gawk", "7zip");

    /** Return code column of a balance test command line, [start, end). */
    public static final int BALANCE_CODE_START = 25;
    public static final int BALANCE_CODE_END = 29;

    /** Balance test codes that abort on return code greater than 1. */
    public static final List<String> BALANCE_GTR_CODES = List.of("5100", "5101", "5102");
}

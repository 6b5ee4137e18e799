package com.batchjob.generator.classify;

/**
 * Closed set of line categories, listed in classification precedence order.
 */
public enum LineCategory {
    PHASE_MARKER,
    COMMENT,
    MANAGED_COMMAND,
    EXTERNAL_TOOL_COMMAND,
    FILE_ENUMERATION,
    LOOP_OPEN,
    SIMPLE_DIRECTIVE,
    CALL_OR_PATH_LITERAL,
    FILE_MOVE,
    FILE_DELETE,
    NOTIFIER_CALL,
    OPAQUE
}

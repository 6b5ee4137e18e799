package com.batchjob.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File writes that never leave a half-written destination behind.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a temp file next to the target, then moves it over the target.
     * Parent directories are created if needed. On failure the temp file is removed and
     * the target is left as it was.
     */
    public static void writeAtomically(Path filePath, String content, Charset charset) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }

        Path temp = Files.createTempFile(parentDir, "." + target.getFileName(), ".part");
        try {
            Files.writeString(temp, content, charset);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}

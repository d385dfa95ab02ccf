package com.acme.werp.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Arrays;

public final class FsUtil {
    private FsUtil() {}

    public static String read(Path p, int maxBytes) throws IOException {
        byte[] b = Files.readAllBytes(p);
        if (b.length > maxBytes) b = Arrays.copyOf(b, maxBytes);
        return new String(b, StandardCharsets.UTF_8);
    }

    /** Writes to a sibling temp file, then moves it over the target. */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

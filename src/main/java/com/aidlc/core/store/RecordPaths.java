package com.aidlc.core.store;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Resolves intent and unit ids to record files, refusing anything that would leave the
 * records root or that does not name a record of the expected kind.
 */
public class RecordPaths {

    static final String INTENT_FILE = "intent.md";
    static final String UNIT_PREFIX = "unit-";
    static final String RECORD_SUFFIX = ".md";

    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private final Path recordsRoot;

    public RecordPaths(Path recordsRoot) {
        this.recordsRoot = recordsRoot.toAbsolutePath().normalize();
    }

    public Path recordsRoot() {
        return recordsRoot;
    }

    public Path intentDir(String intentId) {
        requireSafeId("intent", intentId);
        Path dir = recordsRoot.resolve(intentId).normalize();
        if (!dir.getParent().equals(recordsRoot)) {
            throw new RecordPathException("Intent id escapes records root: " + intentId);
        }
        return dir;
    }

    public Path intentFile(String intentId) {
        return intentDir(intentId).resolve(INTENT_FILE);
    }

    public Path unitFile(String intentId, String unitId) {
        Path dir = intentDir(intentId);
        requireSafeId("unit", unitId);
        if (!unitId.startsWith(UNIT_PREFIX)) {
            throw new RecordPathException("Not a unit record id (expected unit-*): " + unitId);
        }
        Path file = dir.resolve(unitId + RECORD_SUFFIX).normalize();
        if (!dir.equals(file.getParent())) {
            throw new RecordPathException("Unit id escapes intent directory: " + unitId);
        }
        return file;
    }

    static boolean isUnitFileName(String fileName) {
        return fileName.startsWith(UNIT_PREFIX) && fileName.endsWith(RECORD_SUFFIX);
    }

    static String unitIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - RECORD_SUFFIX.length());
    }

    private static void requireSafeId(String kind, String id) {
        if (id == null || id.isBlank()) {
            throw new RecordPathException("Empty " + kind + " id");
        }
        if (!SAFE_ID.matcher(id).matches() || id.contains("..")) {
            throw new RecordPathException("Illegal characters in " + kind + " id: " + id);
        }
    }
}

package com.aidlc.core.store;

import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Unit records stored as {@code unit-NN-slug.md} files with YAML frontmatter:
 * <pre>
 * ---
 * status: pending
 * depends_on: [unit-01-setup, unit-03-session]
 * branch: ai-dlc/intent/04-auth
 * discipline: backend
 * ---
 * </pre>
 */
public class FileUnitStore implements UnitStore {

    private static final Logger log = LoggerFactory.getLogger(FileUnitStore.class);

    private static final Pattern DESCRIPTION = Pattern.compile("^## Description\\n+([^\\n]+)", Pattern.MULTILINE);

    static final Comparator<Unit> BY_ORDINAL = Comparator.comparingInt(Unit::ordinal).thenComparing(Unit::id);

    private final RecordPaths paths;

    public FileUnitStore(RecordPaths paths) {
        this.paths = paths;
    }

    @Override
    public List<Unit> loadUnits(String intentId) {
        Path dir = paths.intentDir(intentId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        var units = new ArrayList<Unit>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(f -> RecordPaths.isUnitFileName(f.getFileName().toString())).toList()) {
                read(file).ifPresent(units::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list units of intent " + intentId, e);
        }
        units.sort(BY_ORDINAL);
        return units;
    }

    @Override
    public Optional<Unit> loadUnit(String intentId, String unitId) {
        return read(paths.unitFile(intentId, unitId));
    }

    @Override
    public StoreResult updateStatus(String intentId, String unitId, String newStatus) {
        Path file;
        try {
            file = paths.unitFile(intentId, unitId);
        } catch (RecordPathException e) {
            log.warn("Rejected status update for {}/{}: {}", intentId, unitId, e.getMessage());
            return StoreResult.failure(StoreResult.StoreError.PATH_VIOLATION, e.getMessage());
        }

        Optional<UnitStatus> status = UnitStatus.fromValue(newStatus);
        if (status.isEmpty()) {
            return StoreResult.failure(StoreResult.StoreError.INVALID_STATUS,
                    "Invalid status '" + newStatus + "'. Must be: pending, in_progress, completed, or blocked");
        }

        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            FrontmatterDocument updated = FrontmatterDocument.parse(content)
                    .with("status", status.get().value());
            AtomicFiles.write(file, updated.render());
            log.info("Unit {}/{} -> {}", intentId, unitId, status.get().value());
            return StoreResult.ok(unitId + " is now " + status.get().value());
        } catch (NoSuchFileException e) {
            return StoreResult.failure(StoreResult.StoreError.NOT_FOUND, "Unit not found: " + unitId);
        } catch (IOException | MalformedRecordException e) {
            log.error("Failed to update unit {}/{}", intentId, unitId, e);
            return StoreResult.failure(StoreResult.StoreError.IO_FAILURE,
                    "Cannot update " + unitId + ": " + e.getMessage());
        }
    }

    private Optional<Unit> read(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read unit record " + file, e);
        }
        return Optional.of(toUnit(RecordPaths.unitIdOf(file), FrontmatterDocument.parse(content)));
    }

    static Unit toUnit(String id, FrontmatterDocument doc) {
        UnitStatus status = doc.getString("status")
                .map(raw -> UnitStatus.fromValue(raw)
                        .orElseThrow(() -> new MalformedRecordException(
                                "Unit " + id + " has unrecognised status '" + raw + "'")))
                .orElse(UnitStatus.PENDING);

        List<String> deps = doc.getStringList("depends_on").stream().distinct().toList();

        Matcher m = DESCRIPTION.matcher(doc.body());
        String description = m.find() ? m.group(1).trim() : null;

        return new Unit(id, status, deps,
                doc.getString("branch").orElse(null),
                doc.getString("discipline").orElse(null),
                description);
    }
}

package com.aidlc.core.store;

import com.aidlc.core.model.Intent;
import com.aidlc.core.model.IntentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Intent records stored as {@code <intent>/intent.md}. Title, problem, solution and criteria come
 * from the markdown body; status, workflow, timestamps and VCS overrides from the frontmatter.
 */
public class FileIntentStore implements IntentStore {

    private static final Logger log = LoggerFactory.getLogger(FileIntentStore.class);

    private static final Pattern TITLE = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern CRITERION = Pattern.compile("^-\\s*\\[[ xX]\\]\\s*(.+)$");

    private final RecordPaths paths;

    public FileIntentStore(RecordPaths paths) {
        this.paths = paths;
    }

    @Override
    public Optional<Intent> loadIntent(String intentId) {
        Path file = paths.intentFile(intentId);
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(toIntent(intentId, FrontmatterDocument.parse(content)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read intent " + intentId, e);
        }
    }

    @Override
    public List<String> listIntents() {
        Path root = paths.recordsRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(d -> Files.isRegularFile(d.resolve(RecordPaths.INTENT_FILE)))
                    .map(d -> d.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list intents under " + root, e);
        }
    }

    @Override
    public StoreResult markCompleted(String intentId, Instant completedAt) {
        Path file;
        try {
            file = paths.intentFile(intentId);
        } catch (RecordPathException e) {
            return StoreResult.failure(StoreResult.StoreError.PATH_VIOLATION, e.getMessage());
        }
        try {
            FrontmatterDocument doc = FrontmatterDocument.parse(Files.readString(file, StandardCharsets.UTF_8));
            if (doc.getString("status").filter(IntentStatus.COMPLETED.value()::equals).isPresent()) {
                log.debug("Intent {} already completed", intentId);
                return StoreResult.ok("Intent " + intentId + " already completed");
            }
            FrontmatterDocument updated = doc
                    .with("status", IntentStatus.COMPLETED.value())
                    .with("completed_at", completedAt.toString());
            AtomicFiles.write(file, updated.render());
            log.info("Intent {} marked completed", intentId);
            return StoreResult.ok("Intent " + intentId + " completed");
        } catch (NoSuchFileException e) {
            return StoreResult.failure(StoreResult.StoreError.NOT_FOUND, "Intent not found: " + intentId);
        } catch (IOException | MalformedRecordException e) {
            log.error("Failed to mark intent {} completed", intentId, e);
            return StoreResult.failure(StoreResult.StoreError.IO_FAILURE,
                    "Cannot update intent " + intentId + ": " + e.getMessage());
        }
    }

    static Intent toIntent(String slug, FrontmatterDocument doc) {
        String body = doc.body();

        Matcher title = TITLE.matcher(body);
        IntentStatus status = doc.getString("status")
                .map(raw -> IntentStatus.fromValue(raw)
                        .orElseThrow(() -> new MalformedRecordException(
                                "Intent " + slug + " has unrecognised status '" + raw + "'")))
                .orElse(IntentStatus.ACTIVE);

        return new Intent(
                slug,
                title.find() ? title.group(1).trim() : "Untitled Intent",
                section(body, "Problem"),
                section(body, "Solution"),
                criteria(section(body, "Success Criteria")),
                doc.getString("workflow").orElse(null),
                status,
                timestamp(slug, doc.getString("created").orElse(null)),
                timestamp(slug, doc.getString("completed_at").orElse(null)),
                VcsOverridesMapper.fromMap(doc.getMap(VcsOverridesMapper.BLOCK_KEY)));
    }

    static String section(String body, String heading) {
        Pattern p = Pattern.compile("^## " + Pattern.quote(heading) + "\\n+(.*?)(?=\\n##|\\z)",
                Pattern.MULTILINE | Pattern.DOTALL);
        Matcher m = p.matcher(body);
        if (!m.find()) return null;
        String text = m.group(1).trim();
        return text.isEmpty() ? null : text;
    }

    private static List<String> criteria(String section) {
        if (section == null) return List.of();
        var result = new ArrayList<String>();
        for (String line : section.split("\n")) {
            Matcher m = CRITERION.matcher(line.trim());
            if (m.matches()) {
                result.add(m.group(1).trim());
            }
        }
        return result;
    }

    private static Instant timestamp(String slug, String raw) {
        if (raw == null) return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                log.warn("Intent {} has unparseable timestamp '{}'", slug, raw);
                return null;
            }
        }
    }
}

package com.aidlc.core.phase;

import com.aidlc.core.config.AidlcProperties;
import com.aidlc.core.store.FrontmatterDocument;
import com.aidlc.core.store.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named workflows (ordered hat lists). Built-in definitions come from configuration; a project
 * {@code workflows.yml} in the records root adds workflows or replaces built-ins of the same name:
 * <pre>
 * hotfix:
 *   description: Skip elaboration for urgent fixes
 *   hats: [planner, builder, reviewer]
 * </pre>
 */
public class WorkflowCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCatalog.class);

    static final String PROJECT_FILE = "workflows.yml";

    public record Workflow(String name, String description, List<String> hats) {

        public Workflow {
            hats = List.copyOf(hats);
        }
    }

    private final AidlcProperties.Workflows builtIns;
    private final Path projectFile;

    public WorkflowCatalog(AidlcProperties.Workflows builtIns, Path recordsRoot) {
        this.builtIns = builtIns;
        this.projectFile = recordsRoot.resolve(PROJECT_FILE);
    }

    /**
     * All workflows, built-ins first, project definitions overriding by name.
     */
    public Map<String, Workflow> workflows() {
        var result = new LinkedHashMap<String, Workflow>();
        builtIns.getDefinitions().forEach((name, def) ->
                result.put(name, new Workflow(name, def.getDescription(), def.getHats())));
        result.putAll(projectWorkflows());
        return result;
    }

    public Optional<Workflow> find(String name) {
        return Optional.ofNullable(workflows().get(name));
    }

    /**
     * Resolves an intent's workflow. A missing or unknown name falls back to the default workflow.
     */
    public Workflow resolve(String name) {
        Map<String, Workflow> all = workflows();
        if (name != null && all.containsKey(name)) {
            return all.get(name);
        }
        if (name != null) {
            log.warn("Unknown workflow '{}', using '{}'", name, builtIns.getDefaultWorkflow());
        }
        Workflow fallback = all.get(builtIns.getDefaultWorkflow());
        if (fallback == null) {
            throw new IllegalStateException("Default workflow '" + builtIns.getDefaultWorkflow() + "' is not defined");
        }
        return fallback;
    }

    private Map<String, Workflow> projectWorkflows() {
        if (!Files.isRegularFile(projectFile)) {
            return Map.of();
        }
        Map<String, Object> raw;
        try {
            raw = FrontmatterDocument.readYaml(Files.readString(projectFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + projectFile, e);
        }

        var result = new LinkedHashMap<String, Workflow>();
        for (var entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> def)) {
                throw new MalformedRecordException("Workflow '" + entry.getKey() + "' must be a mapping");
            }
            var hats = new ArrayList<String>();
            if (def.get("hats") instanceof List<?> list) {
                list.forEach(h -> hats.add(String.valueOf(h).trim()));
            }
            if (hats.isEmpty()) {
                throw new MalformedRecordException("Workflow '" + entry.getKey() + "' defines no hats");
            }
            Object description = def.get("description");
            result.put(entry.getKey(), new Workflow(entry.getKey(),
                    description == null ? "" : String.valueOf(description), hats));
        }
        return result;
    }
}

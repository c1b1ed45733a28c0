package com.aidlc.core.dag;

import com.aidlc.core.model.BlockedUnit;
import com.aidlc.core.model.DagClassification;
import com.aidlc.core.model.Unit;
import com.aidlc.core.model.UnitStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Projects a unit graph into a diagram. Grouping follows {@link DagResolver#classify}; colours and
 * icons are cosmetic.
 */
@Component
public class DagRenderer {

    private final DagResolver resolver;

    public DagRenderer(DagResolver resolver) {
        this.resolver = resolver;
    }

    public String render(List<Unit> units, DagFormat format) {
        return switch (format) {
            case MERMAID -> mermaid(units);
            case ASCII -> ascii(units);
            case TABLE -> table(units);
        };
    }

    String mermaid(List<Unit> units) {
        if (units.isEmpty()) {
            return "```mermaid\ngraph LR\n    START([Start]) --> END([Complete])\n```";
        }
        DagClassification classes = resolver.classify(units);
        var lines = new ArrayList<String>();
        lines.add("```mermaid");
        lines.add("graph TD");

        for (Unit unit : units) {
            lines.add("    " + nodeId(unit.id()) + "[" + label(unit.id()) + "]:::" + styleClass(unit, classes));
        }

        Set<String> dependedOn = new HashSet<>();
        for (Unit unit : units) {
            if (unit.dependsOn().isEmpty()) {
                lines.add("    START([Start]) --> " + nodeId(unit.id()));
            }
            for (String dep : unit.dependsOn()) {
                lines.add("    " + nodeId(dep) + " --> " + nodeId(unit.id()));
                dependedOn.add(dep);
            }
        }
        for (Unit unit : units) {
            if (!dependedOn.contains(unit.id())) {
                lines.add("    " + nodeId(unit.id()) + " --> END([Complete])");
            }
        }

        lines.add("");
        lines.add("    classDef completed fill:#22c55e,stroke:#16a34a,color:white");
        lines.add("    classDef inProgress fill:#3b82f6,stroke:#2563eb,color:white");
        lines.add("    classDef ready fill:#94a3b8,stroke:#64748b,color:white");
        lines.add("    classDef blocked fill:#ef4444,stroke:#dc2626,color:white");
        lines.add("```");
        return String.join("\n", lines);
    }

    String ascii(List<Unit> units) {
        if (units.isEmpty()) {
            return "No units defined.";
        }
        DagClassification classes = resolver.classify(units);
        Map<String, Unit> byId = new HashMap<>();
        for (Unit unit : units) {
            byId.put(unit.id(), unit);
        }
        Map<String, Integer> levels = new HashMap<>();
        Map<Integer, List<Unit>> byLevel = new TreeMap<>();
        for (Unit unit : units) {
            int level = level(unit.id(), byId, levels, new LinkedHashSet<>());
            byLevel.computeIfAbsent(level, k -> new ArrayList<>()).add(unit);
        }

        var lines = new ArrayList<String>();
        lines.add("Unit Dependency Graph");
        lines.add("=====================");
        lines.add("");
        lines.add("Legend: [ ] ready  [~] in-progress  [x] completed  [!] blocked");
        lines.add("");
        for (var entry : byLevel.entrySet()) {
            String indent = "  ".repeat(entry.getKey());
            for (Unit unit : entry.getValue()) {
                String deps = unit.dependsOn().isEmpty() ? "" : " <- [" + unit.dependsOn().stream()
                        .map(DagRenderer::label)
                        .collect(Collectors.joining(", ")) + "]";
                lines.add(indent + icon(unit, classes) + " " + label(unit.id()) + deps);
            }
        }
        return String.join("\n", lines);
    }

    String table(List<Unit> units) {
        if (units.isEmpty()) {
            return "No units found.";
        }
        DagClassification classes = resolver.classify(units);
        Map<String, List<String>> blockers = new HashMap<>();
        for (BlockedUnit b : classes.blocked()) {
            blockers.put(b.unitId(), b.blockedBy());
        }
        var lines = new ArrayList<String>();
        lines.add("| Unit | Status | Blocked By |");
        lines.add("|------|--------|------------|");
        for (Unit unit : units) {
            lines.add("| " + unit.id() + " | " + unit.status().value() + " | "
                    + String.join(", ", blockers.getOrDefault(unit.id(), List.of())) + " |");
        }
        return String.join("\n", lines);
    }

    /**
     * Depth of a unit: 0 without dependencies, otherwise one more than its deepest dependency.
     * A dependency already on the current path (a cycle) contributes depth 0.
     */
    private static int level(String id, Map<String, Unit> byId, Map<String, Integer> levels, Set<String> path) {
        Integer known = levels.get(id);
        if (known != null) return known;
        Unit unit = byId.get(id);
        if (unit == null || path.contains(id)) return 0;

        path.add(id);
        int max = -1;
        for (String dep : unit.dependsOn()) {
            max = Math.max(max, level(dep, byId, levels, path));
        }
        path.remove(id);

        int level = max + 1;
        levels.put(id, level);
        return level;
    }

    private static String styleClass(Unit unit, DagClassification classes) {
        if (unit.status() == UnitStatus.COMPLETED) return "completed";
        if (unit.status() == UnitStatus.IN_PROGRESS) return "inProgress";
        return classes.isReady(unit.id()) ? "ready" : "blocked";
    }

    private static String icon(Unit unit, DagClassification classes) {
        return switch (styleClass(unit, classes)) {
            case "completed" -> "[x]";
            case "inProgress" -> "[~]";
            case "ready" -> "[ ]";
            default -> "[!]";
        };
    }

    private static String nodeId(String unitId) {
        return unitId.startsWith("unit-") ? "u" + unitId.substring("unit-".length()) : unitId;
    }

    private static String label(String unitId) {
        return unitId.startsWith("unit-") ? unitId.substring("unit-".length()) : unitId;
    }
}

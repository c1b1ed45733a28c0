package com.aidlc.core.dag;

import com.aidlc.core.model.Unit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aidlc.core.model.UnitStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class DagRendererTest {

    private final DagRenderer renderer = new DagRenderer(new DagResolver());

    private final List<Unit> units = List.of(
            Unit.of("unit-01-setup", COMPLETED),
            Unit.of("unit-02-api", PENDING, "unit-01-setup"),
            Unit.of("unit-03-ui", PENDING, "unit-02-api"));

    @Test
    @DisplayName("mermaid output links dependencies and styles by readiness")
    void mermaid() {
        String out = renderer.render(units, DagFormat.MERMAID);

        assertTrue(out.startsWith("```mermaid\ngraph TD"));
        assertTrue(out.contains("u01-setup[01-setup]:::completed"));
        assertTrue(out.contains("u02-api[02-api]:::ready"));
        assertTrue(out.contains("u03-ui[03-ui]:::blocked"));
        assertTrue(out.contains("START([Start]) --> u01-setup"));
        assertTrue(out.contains("u01-setup --> u02-api"));
        assertTrue(out.contains("u03-ui --> END([Complete])"));
        assertTrue(out.endsWith("```"));
    }

    @Test
    @DisplayName("ascii output indents by dependency depth")
    void ascii() {
        String out = renderer.render(units, DagFormat.ASCII);

        assertTrue(out.contains("[x] 01-setup"));
        assertTrue(out.contains("  [ ] 02-api <- [01-setup]"));
        assertTrue(out.contains("    [!] 03-ui <- [02-api]"));
    }

    @Test
    @DisplayName("ascii output terminates on cycles")
    void asciiCycle() {
        var cyclic = List.of(Unit.of("unit-01-a", PENDING, "unit-02-b"), Unit.of("unit-02-b", PENDING, "unit-01-a"));

        String out = renderer.render(cyclic, DagFormat.ASCII);

        assertTrue(out.contains("01-a"));
        assertTrue(out.contains("02-b"));
    }

    @Test
    @DisplayName("table lists blockers")
    void table() {
        String out = renderer.render(units, DagFormat.TABLE);

        assertTrue(out.startsWith("| Unit | Status | Blocked By |"));
        assertTrue(out.contains("| unit-03-ui | pending | unit-02-api |"));
        assertTrue(out.contains("| unit-02-api | pending |  |"));
    }

    @Test
    @DisplayName("empty graphs have placeholder output")
    void empty() {
        assertEquals("No units defined.", renderer.render(List.of(), DagFormat.ASCII));
        assertEquals("No units found.", renderer.render(List.of(), DagFormat.TABLE));
        assertTrue(renderer.render(List.of(), DagFormat.MERMAID).contains("START([Start]) --> END([Complete])"));
    }
}

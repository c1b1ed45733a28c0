package com.aidlc.core.dag;

/**
 * Output formats for {@link DagRenderer}.
 */
public enum DagFormat {
    /** Mermaid {@code graph TD} block with status classes. */
    MERMAID,
    /** Indented text grouped by dependency depth. */
    ASCII,
    /** Markdown table of unit, status and blocking dependencies. */
    TABLE
}

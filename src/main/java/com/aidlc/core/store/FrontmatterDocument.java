package com.aidlc.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Markdown document with a YAML frontmatter block delimited by {@code ---} lines.
 * <p>
 * Keys the typed records do not know about are preserved when the document is re-rendered.
 * YAML comments inside the frontmatter are not preserved.
 */
public final class FrontmatterDocument {

    private static final String DELIMITER = "---";

    static final YAMLMapper YAML = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Map<String, Object> frontmatter;
    private final String body;

    private FrontmatterDocument(Map<String, Object> frontmatter, String body) {
        this.frontmatter = frontmatter;
        this.body = body;
    }

    public static FrontmatterDocument parse(String content) {
        String text = content.replace("\r\n", "\n");
        if (!text.startsWith(DELIMITER + "\n")) {
            return new FrontmatterDocument(new LinkedHashMap<>(), text);
        }
        int start = DELIMITER.length() + 1;
        int end = findClosingDelimiter(text, start);
        if (end < 0) {
            throw new MalformedRecordException("Unterminated frontmatter block");
        }
        String yaml = text.substring(start, end);
        int bodyStart = text.indexOf('\n', end);
        String body = bodyStart < 0 ? "" : text.substring(bodyStart + 1);
        return new FrontmatterDocument(readYaml(yaml), body);
    }

    /**
     * Parses a standalone YAML document (settings or workflows file) into an ordered map.
     */
    public static Map<String, Object> readYaml(String yaml) {
        if (yaml.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> map = YAML.readValue(yaml, MAP_TYPE);
            return map != null ? map : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Invalid YAML: " + e.getOriginalMessage(), e);
        }
    }

    private static int findClosingDelimiter(String text, int from) {
        int pos = from;
        while (pos <= text.length()) {
            int lineEnd = text.indexOf('\n', pos);
            String line = lineEnd < 0 ? text.substring(pos) : text.substring(pos, lineEnd);
            if (line.strip().equals(DELIMITER)) {
                return pos;
            }
            if (lineEnd < 0) return -1;
            pos = lineEnd + 1;
        }
        return -1;
    }

    public String body() {
        return body;
    }

    public Map<String, Object> frontmatter() {
        return Collections.unmodifiableMap(frontmatter);
    }

    public Optional<String> getString(String key) {
        Object value = frontmatter.get(key);
        if (value == null) return Optional.empty();
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    /**
     * Reads a list value. A scalar is treated as a one-element list; null or missing as empty.
     */
    public List<String> getStringList(String key) {
        Object value = frontmatter.get(key);
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            var result = new ArrayList<String>();
            for (Object item : list) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    result.add(String.valueOf(item).trim());
                }
            }
            return result;
        }
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? List.of() : List.of(s);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = frontmatter.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    /**
     * Returns a copy with {@code key} set to {@code value}, keeping the position of existing keys.
     */
    public FrontmatterDocument with(String key, Object value) {
        var copy = new LinkedHashMap<>(frontmatter);
        copy.put(key, value);
        return new FrontmatterDocument(copy, body);
    }

    public String render() {
        var sb = new StringBuilder(DELIMITER).append('\n');
        if (!frontmatter.isEmpty()) {
            try {
                sb.append(YAML.writeValueAsString(frontmatter));
            } catch (JsonProcessingException e) {
                throw new MalformedRecordException("Cannot render frontmatter", e);
            }
        }
        if (sb.charAt(sb.length() - 1) != '\n') sb.append('\n');
        sb.append(DELIMITER).append('\n');
        sb.append(body);
        return sb.toString();
    }
}

package com.stepflow.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.PathException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A parsed path expression. Immutable and safe to share between executions.
 * 
 * Supported syntax: {@code $}, {@code .field}, {@code ['field']}, {@code [n]}, {@code [n,m]},
 * {@code [*]}, {@code .*}, {@code [start:end:step]}, {@code ..field}, {@code ..*}.
 * Filter expressions are not supported.
 */
public final class CompiledPath {

    private final String expression;
    private final List<PathSegment> segments;

    private CompiledPath(String expression, List<PathSegment> segments) {
        this.expression = expression;
        this.segments = List.copyOf(segments);
    }

    /**
     * Parse a path expression.
     * 
     * @throws PathException if the expression is malformed
     */
    public static CompiledPath compile(String expression) {
        if (expression == null || !expression.startsWith("$")) {
            throw new PathException(expression, "must start with '$'");
        }
        return new CompiledPath(expression, tokenize(expression));
    }

    public String expression() {
        return expression;
    }

    List<PathSegment> segments() {
        return segments;
    }

    /**
     * Check if this path can match at most one node.
     */
    public boolean isDefinite() {
        return segments.stream().allMatch(PathSegment::isDefinite);
    }

    /**
     * Check if this path only walks named fields and single indexes, which makes it usable as
     * a write location (ResultPath).
     */
    public boolean isReference() {
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.Field) {
                continue;
            }
            if (segment instanceof PathSegment.Index index
                    && index.isDefinite() && index.indexes().get(0) >= 0) {
                continue;
            }
            return false;
        }
        return true;
    }

    /**
     * Evaluate against a document.
     * 
     * @return Matches in document order
     */
    public List<JsonNode> evaluate(JsonNode root) {
        List<JsonNode> current = new ArrayList<>();
        if (root != null) {
            current.add(root);
        }
        for (PathSegment segment : segments) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                apply(segment, node, next);
            }
            current = next;
        }
        return current;
    }

    @Override
    public String toString() {
        return expression;
    }

    // ========== Evaluation ==========

    private static void apply(PathSegment segment, JsonNode node, List<JsonNode> out) {
        if (segment instanceof PathSegment.Field field) {
            if (node.isObject() && node.has(field.name())) {
                out.add(node.get(field.name()));
            }
        } else if (segment instanceof PathSegment.Index index) {
            if (!node.isArray()) {
                return;
            }
            for (int i : index.indexes()) {
                int resolved = i < 0 ? node.size() + i : i;
                if (resolved >= 0 && resolved < node.size()) {
                    out.add(node.get(resolved));
                }
            }
        } else if (segment instanceof PathSegment.Wildcard) {
            children(node, out);
        } else if (segment instanceof PathSegment.Slice slice) {
            selectSlice(node, slice, out);
        } else if (segment instanceof PathSegment.Descent descent) {
            descend(node, descent.name(), out);
        }
    }

    private static void children(JsonNode node, List<JsonNode> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                out.add(fields.next().getValue());
            }
        } else if (node.isArray()) {
            node.forEach(out::add);
        }
    }

    private static void selectSlice(JsonNode node, PathSegment.Slice slice, List<JsonNode> out) {
        if (!node.isArray()) {
            return;
        }
        int size = node.size();
        int start = normalize(slice.start(), 0, size);
        int end = normalize(slice.end(), size, size);
        // long index so a large step cannot wrap around
        for (long i = start; i < end; i += slice.step()) {
            out.add(node.get((int) i));
        }
    }

    private static int normalize(Integer bound, int fallback, int size) {
        if (bound == null) {
            return fallback;
        }
        int resolved = bound < 0 ? size + bound : bound;
        return Math.max(0, Math.min(resolved, size));
    }

    private static void descend(JsonNode node, String name, List<JsonNode> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (name == null || entry.getKey().equals(name)) {
                    out.add(entry.getValue());
                }
                descend(entry.getValue(), name, out);
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                if (name == null) {
                    out.add(child);
                }
                descend(child, name, out);
            }
        }
    }

    // ========== Parsing ==========

    private static List<PathSegment> tokenize(String path) {
        List<PathSegment> segments = new ArrayList<>();
        int i = 1;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                if (i + 1 < path.length() && path.charAt(i + 1) == '.') {
                    int start = i + 2;
                    int end = readFieldName(path, start);
                    String name = path.substring(start, end);
                    if (name.isEmpty()) {
                        throw new PathException(path, "empty name after '..' at position " + i);
                    }
                    segments.add(new PathSegment.Descent("*".equals(name) ? null : name));
                    i = end;
                } else {
                    int start = i + 1;
                    int end = readFieldName(path, start);
                    String name = path.substring(start, end);
                    if (name.isEmpty()) {
                        throw new PathException(path, "empty field name at position " + i);
                    }
                    segments.add("*".equals(name) ? new PathSegment.Wildcard() : new PathSegment.Field(name));
                    i = end;
                }
            } else if (c == '[') {
                int end = closingBracket(path, i);
                segments.add(parseBracket(path, path.substring(i + 1, end).trim()));
                i = end + 1;
            } else {
                throw new PathException(path, "unexpected character '" + c + "' at position " + i);
            }
        }
        return segments;
    }

    private static int readFieldName(String path, int start) {
        int i = start;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.' || c == '[') {
                break;
            }
            i++;
        }
        return i;
    }

    private static int closingBracket(String path, int open) {
        char quote = 0;
        for (int i = open + 1; i < path.length(); i++) {
            char c = path.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ']') {
                return i;
            }
        }
        throw new PathException(path, "unclosed '[' at position " + open);
    }

    private static PathSegment parseBracket(String path, String inside) {
        if (inside.isEmpty()) {
            throw new PathException(path, "empty brackets");
        }
        if (isQuoted(inside)) {
            return new PathSegment.Field(inside.substring(1, inside.length() - 1));
        }
        if (inside.equals("*")) {
            return new PathSegment.Wildcard();
        }
        if (inside.startsWith("?")) {
            throw new PathException(path, "filter expressions are not supported");
        }
        try {
            if (inside.contains(":")) {
                String[] parts = inside.split(":", -1);
                if (parts.length > 3) {
                    throw new PathException(path, "malformed slice [" + inside + "]");
                }
                Integer start = parts[0].isBlank() ? null : Integer.parseInt(parts[0].trim());
                Integer end = parts.length > 1 && !parts[1].isBlank() ? Integer.parseInt(parts[1].trim()) : null;
                int step = parts.length > 2 && !parts[2].isBlank() ? Integer.parseInt(parts[2].trim()) : 1;
                if (step < 1) {
                    throw new PathException(path, "slice step must be positive");
                }
                return new PathSegment.Slice(start, end, step);
            }
            List<Integer> indexes = new ArrayList<>();
            for (String part : inside.split(",")) {
                indexes.add(Integer.parseInt(part.trim()));
            }
            return new PathSegment.Index(List.copyOf(indexes));
        } catch (NumberFormatException e) {
            throw new PathException(path, "invalid index [" + inside + "]");
        }
    }

    private static boolean isQuoted(String s) {
        return s.length() >= 2
            && ((s.startsWith("'") && s.endsWith("'")) || (s.startsWith("\"") && s.endsWith("\"")));
    }
}

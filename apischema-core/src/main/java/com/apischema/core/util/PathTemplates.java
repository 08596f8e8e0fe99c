package com.apischema.core.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utilities for path templates such as {@code /api/{version}/users/{id}/}.
 */
public final class PathTemplates {

    /** Reserved placeholder replaced by the documented API version */
    public static final String VERSION_VARIABLE = "version";

    public static final String VERSION_PLACEHOLDER = "{" + VERSION_VARIABLE + "}";

    public static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([^{}/]+)}");

    private PathTemplates() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the distinct variable names of a template in order of appearance.
     *
     * @param path path template
     * @return variable names
     */
    public static Set<String> variables(String path) {
        Set<String> variables = new LinkedHashSet<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(path);
        while (matcher.find()) {
            variables.add(matcher.group(1));
        }
        return variables;
    }

    /**
     * Checks that braces are balanced and not nested.
     *
     * @param path path template
     * @return true if every opening brace is closed before the next one opens
     */
    public static boolean isWellFormed(String path) {
        boolean open = false;
        for (char c : path.toCharArray()) {
            if (c == '{') {
                if (open) {
                    return false;
                }
                open = true;
            } else if (c == '}') {
                if (!open) {
                    return false;
                }
                open = false;
            }
        }
        return !open;
    }

    /**
     * Returns whether a segment is a template variable.
     *
     * @param segment path segment
     * @return true if it contains an opening brace
     */
    public static boolean isVariable(String segment) {
        return segment.contains("{");
    }

    /**
     * Splits a template into tree keys: non-empty segments, without the version placeholder.
     *
     * @param path path template
     * @return segments in order
     */
    public static List<String> keySegments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty() && !segment.equals(VERSION_PLACEHOLDER)) {
                segments.add(segment);
            }
        }
        return segments;
    }

    /**
     * Returns the key segments shared by every path that can be stripped.
     *
     * <p>This is the longest run of leading static segments common to all paths, minus its
     * last segment, so the topmost shared resource stays a named node.
     *
     * @param paths path templates
     * @return prefix segments, possibly empty
     */
    public static List<String> strippablePrefix(List<String> paths) {
        List<String> common = null;
        for (String path : paths) {
            List<String> leading = new ArrayList<>();
            for (String segment : keySegments(path)) {
                if (isVariable(segment)) {
                    break;
                }
                leading.add(segment);
            }
            if (common == null) {
                common = leading;
            } else {
                int shared = 0;
                while (shared < common.size() && shared < leading.size()
                    && common.get(shared).equals(leading.get(shared))) {
                    shared++;
                }
                common = new ArrayList<>(common.subList(0, shared));
            }
        }
        if (common == null || common.isEmpty()) {
            return List.of();
        }
        return List.copyOf(common.subList(0, common.size() - 1));
    }
}

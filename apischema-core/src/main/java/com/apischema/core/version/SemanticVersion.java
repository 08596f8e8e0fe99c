package com.apischema.core.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed, comparable version number.
 *
 * <p>Ordering is numeric per release segment, so {@code 1.10 > 1.9}. Trailing zero
 * segments are insignificant ({@code 1.0 == 1.0.0}). An optional qualifier orders
 * pre-releases before and post-releases after the plain release:
 * <pre>
 * 1.0.dev1 &lt; 1.0a1 &lt; 1.0b2 &lt; 1.0rc1 &lt; 1.0 &lt; 1.0.post1
 * </pre>
 *
 * @param release numeric release segments, trailing zeros removed
 * @param qualifierRank rank of the qualifier ({@link #FINAL_RANK} for none)
 * @param qualifierNumber number following the qualifier, 0 when absent
 */
public record SemanticVersion(
    List<Integer> release,
    int qualifierRank,
    int qualifierNumber
) implements Comparable<SemanticVersion> {

    /** Rank of a version without qualifier. */
    public static final int FINAL_RANK = 4;

    private static final Pattern VERSION_PATTERN = Pattern.compile(
        "^[vV]?(\\d+(?:\\.\\d+)*)(?:[-_.]?([a-zA-Z]+)[-_.]?(\\d*))?$");

    /**
     * Compact constructor with validation.
     */
    public SemanticVersion {
        Objects.requireNonNull(release, "release must not be null");
        release = List.copyOf(release);
    }

    /**
     * Parses a version string.
     *
     * @param text version text such as {@code "1.10"}, {@code "v2"} or {@code "1.0rc1"}
     * @return parsed version
     * @throws VersionParseException if the text is not a version
     */
    public static SemanticVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new VersionParseException(text, "Version must not be empty");
        }
        Matcher matcher = VERSION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new VersionParseException(text, "Invalid version: '" + text + "'");
        }

        List<Integer> segments = new ArrayList<>();
        for (String segment : matcher.group(1).split("\\.")) {
            segments.add(number(text, segment, "Version segment"));
        }
        while (segments.size() > 1 && segments.get(segments.size() - 1) == 0) {
            segments.remove(segments.size() - 1);
        }

        int rank = FINAL_RANK;
        int number = 0;
        if (matcher.group(2) != null) {
            rank = qualifierRank(text, matcher.group(2));
            String digits = matcher.group(3);
            number = digits == null || digits.isEmpty() ? 0 : number(text, digits, "Qualifier number");
        }
        return new SemanticVersion(segments, rank, number);
    }

    private static int number(String text, String digits, String what) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new VersionParseException(text, what + " out of range: '" + digits + "'");
        }
    }

    private static int qualifierRank(String text, String qualifier) {
        return switch (qualifier.toLowerCase(Locale.ROOT)) {
            case "dev" -> 0;
            case "a", "alpha" -> 1;
            case "b", "beta" -> 2;
            case "c", "rc", "pre", "preview" -> 3;
            case "post", "rev", "r" -> 5;
            default -> throw new VersionParseException(text, "Unknown version qualifier '" + qualifier + "' in '" + text + "'");
        };
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int length = Math.max(release.size(), other.release.size());
        for (int i = 0; i < length; i++) {
            int left = i < release.size() ? release.get(i) : 0;
            int right = i < other.release.size() ? other.release.get(i) : 0;
            if (left != right) {
                return Integer.compare(left, right);
            }
        }
        if (qualifierRank != other.qualifierRank) {
            return Integer.compare(qualifierRank, other.qualifierRank);
        }
        return Integer.compare(qualifierNumber, other.qualifierNumber);
    }
}

package org.pragmatica.dnsb.compiler.version;

import org.pragmatica.lang.Result;
import org.pragmatica.lang.parse.Number;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version of a DNS server package, as written in image presets: one to three numeric parts
 * ({@code 9}, {@code 9.18}, {@code 9.18.24}) and an optional pre-release tail, either after a dash
 * ({@code 9.19.0-rc1}) or glued to the last number ({@code 1.19.0rc1}). Missing parts are zero.
 *
 * <p>A release orders after any of its pre-releases. Pre-release tails compare part by part,
 * where digit runs compare numerically and sort before text parts.
 */
public record SoftwareVersion(int major, int minor, int patch, List<String> prerelease, String text)
    implements Comparable<SoftwareVersion> {
    private static final Pattern FORMAT = Pattern.compile(
        "^(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z.\\-]+)|([A-Za-z][0-9A-Za-z.\\-]*))?(?:\\+\\S*)?$");
    private static final Pattern PRERELEASE_PART = Pattern.compile("\\d+|[^\\d.]+");

    public SoftwareVersion {
        prerelease = List.copyOf(prerelease);
    }

    public static Result<SoftwareVersion> softwareVersion(String text) {
        var trimmed = text.trim();
        var matcher = FORMAT.matcher(trimmed);
        if (!matcher.matches()) {
            return new VersionError.InvalidVersion(text).result();
        }
        var tail = matcher.group(4) != null
                   ? matcher.group(4)
                   : matcher.group(5);
        return Result.all(Number.parseInt(matcher.group(1)),
                          number(matcher, 2),
                          number(matcher, 3))
                     .map((major, minor, patch) -> new SoftwareVersion(major, minor, patch, prereleaseParts(tail), trimmed))
                     .mapError(cause -> new VersionError.InvalidVersion(text));
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    @Override
    public int compareTo(SoftwareVersion other) {
        var core = compareCore(other);
        if (core != 0) {
            return core;
        }
        if (isPrerelease() != other.isPrerelease()) {
            return isPrerelease()
                   ? -1
                   : 1;
        }
        return comparePrerelease(prerelease, other.prerelease);
    }

    /**
     * Equal numbers and pre-release tails. The original text is not compared.
     */
    public boolean sameAs(SoftwareVersion other) {
        return compareTo(other) == 0;
    }

    @Override
    public String toString() {
        return text;
    }

    private int compareCore(SoftwareVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    private static Result<Integer> number(Matcher matcher, int group) {
        return matcher.group(group) == null
               ? Result.success(0)
               : Number.parseInt(matcher.group(group));
    }

    private static List<String> prereleaseParts(String tail) {
        var parts = new ArrayList<String>();
        if (tail == null) {
            return parts;
        }
        var matcher = PRERELEASE_PART.matcher(tail);
        while (matcher.find()) {
            parts.add(matcher.group());
        }
        return parts;
    }

    private static int comparePrerelease(List<String> left, List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            var result = comparePart(left.get(i), right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int comparePart(String left, String right) {
        var leftNumeric = isNumeric(left);
        var rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            var stripped = stripZeros(left);
            var otherStripped = stripZeros(right);
            return stripped.length() != otherStripped.length()
                   ? Integer.compare(stripped.length(), otherStripped.length())
                   : stripped.compareTo(otherStripped);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric
                   ? -1
                   : 1;
        }
        return left.compareTo(right);
    }

    private static boolean isNumeric(String part) {
        return Character.isDigit(part.charAt(0));
    }

    private static String stripZeros(String digits) {
        var start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}

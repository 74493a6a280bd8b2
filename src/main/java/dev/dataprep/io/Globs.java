package dev.dataprep.io;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell-style pattern helpers shared by the filter evaluator and the path resolver.
 */
final class Globs {

    private static final String WILDCARDS = "*?[";
    private static final String META = "*?[]{}\\";

    private Globs() {}

    static boolean hasWildcard(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (WILDCARDS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Translate a shell pattern to a regex. With {@code pathAware} a single {@code *} or {@code ?}
     * stays inside one path segment, {@code **} crosses segments and a leading {@code **}/ also
     * matches zero directories. Without it, {@code *} matches any run of characters, slashes included.
     */
    static Pattern compile(String glob, boolean pathAware, boolean ignoreCase) {
        int flags = Pattern.DOTALL;
        if (ignoreCase) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return Pattern.compile(toRegex(glob, pathAware), flags);
    }

    static String toRegex(String glob, boolean pathAware) {
        var sb = new StringBuilder();
        int n = glob.length();
        int i = 0;
        while (i < n) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (pathAware && i + 1 < n && glob.charAt(i + 1) == '*') {
                    if (i + 2 < n && glob.charAt(i + 2) == '/') {
                        sb.append("(?:.*/)?");
                        i += 3;
                    } else {
                        sb.append(".*");
                        i += 2;
                    }
                    continue;
                }
                sb.append(pathAware ? "[^/]*" : ".*");
            } else if (c == '?') {
                sb.append(pathAware ? "[^/]" : ".");
            } else if (c == '[') {
                int j = i + 1;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    sb.append("\\[");
                } else {
                    String body = glob.substring(i + 1, j)
                        .replace("\\", "\\\\")
                        .replace("[", "\\[")
                        .replace("]", "\\]");
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    } else if (body.startsWith("^")) {
                        body = "\\" + body;
                    }
                    sb.append('[').append(body).append(']');
                    i = j;
                }
            } else if (Character.isLetterOrDigit(c) || c == '/' || c == '_') {
                sb.append(c);
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return sb.toString();
    }

    /** Escape pattern characters so the text matches only itself. */
    static String escape(String literal) {
        var sb = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (META.indexOf(c) >= 0) {
                sb.append('[').append(c == '\\' ? "\\\\" : String.valueOf(c)).append(']');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Split a path pattern into slash-separated segments, keeping a leading empty segment for absolute paths. */
    static List<String> segments(String pattern) {
        var parts = new ArrayList<String>();
        for (String s : pattern.replace('\\', '/').split("/", -1)) {
            parts.add(s);
        }
        return parts;
    }
}

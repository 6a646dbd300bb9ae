package com.cgi.dbsurveyor.collector.service.orchestrator;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Include/exclude filter over database names.
 * <p>
 * Pattern syntax: {@code /regex/} is a regular expression, a pattern containing
 * {@code *}, {@code ?} or {@code [} is a glob, anything else matches the exact name.
 * Exclusion always wins over inclusion; an empty include list accepts every name.
 */
public final class DatabaseFilter {

    private final List<Predicate<String>> excludes;
    private final List<Predicate<String>> includes;

    /**
     * Constructor.
     *
     * @param excludePatterns Patterns of databases never collected
     * @param includePatterns Patterns restricting collection, empty for all
     * @throws ConfigurationException If a pattern is not a valid expression
     */
    public DatabaseFilter(List<String> excludePatterns, List<String> includePatterns) {
        this.excludes = compileAll(excludePatterns);
        this.includes = compileAll(includePatterns);
    }

    public boolean isExcluded(String databaseName) {
        return excludes.stream().anyMatch(p -> p.test(databaseName));
    }

    public boolean isIncluded(String databaseName) {
        return includes.isEmpty() || includes.stream().anyMatch(p -> p.test(databaseName));
    }

    /**
     * Whether a database passes both lists.
     *
     * @param databaseName Database name
     * @return true if the database should be collected
     */
    public boolean accepts(String databaseName) {
        return !isExcluded(databaseName) && isIncluded(databaseName);
    }

    /**
     * Tests one pattern against one name.
     *
     * @param pattern Exact name, glob or /regex/
     * @param databaseName Database name
     * @return true on match
     */
    public static boolean matches(String pattern, String databaseName) {
        return compile(pattern).test(databaseName);
    }

    private static List<Predicate<String>> compileAll(List<String> patterns) {
        return patterns == null ? List.of() : patterns.stream().map(DatabaseFilter::compile).toList();
    }

    static Predicate<String> compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new ConfigurationException("Database filter pattern cannot be empty");
        }
        if (pattern.length() > 1 && pattern.startsWith("/") && pattern.endsWith("/")) {
            try {
                Pattern regex = Pattern.compile(pattern.substring(1, pattern.length() - 1));
                return name -> name != null && regex.matcher(name).matches();
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid database filter expression: " + pattern);
            }
        }
        if (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0) {
            try {
                Pattern glob = Pattern.compile(globToRegex(pattern));
                return name -> name != null && glob.matcher(name).matches();
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid database filter glob: " + pattern);
            }
        }
        return pattern::equals;
    }

    /**
     * Translates a glob: {@code *} any run, {@code ?} one character, {@code [...]} a class.
     * An unterminated {@code [} is a literal.
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && glob.indexOf(']', i + 1) > i + 1) {
                int end = glob.indexOf(']', i + 1);
                String body = glob.substring(i + 1, end);
                regex.append('[');
                if (body.startsWith("!")) {
                    regex.append('^');
                    body = body.substring(1);
                }
                regex.append(body.replace("\\", "\\\\").replace("[", "\\[").replace("&", "\\&"));
                regex.append(']');
                i = end;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return regex.toString();
    }
}

package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import lombok.Getter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Column-name pattern flagging potentially sensitive content, matched case-insensitively.
 */
@Getter
public final class SensitivePattern {

    private final Pattern pattern;

    /**
     * Human-readable description used in sampling warnings.
     */
    private final String description;

    public SensitivePattern(String regex, String description) {
        try {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid sensitive field pattern: " + regex, e);
        }
        this.description = description;
    }

    /**
     * Whether the column name contains a match.
     *
     * @param columnName Column name
     * @return true on match
     */
    public boolean matches(String columnName) {
        return columnName != null && pattern.matcher(columnName).find();
    }

    @Override
    public String toString() {
        return pattern.pattern() + " (" + description + ")";
    }
}

package com.cgi.dbsurveyor.collector.service.sampling;

import com.cgi.dbsurveyor.collector.config.SensitivePattern;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.Table;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags columns whose name suggests sensitive content.
 * Only names are inspected; values are never read or modified.
 */
@Component
public class SensitiveFieldDetector {

    /**
     * Produces one warning per matching column, using the first matching pattern.
     *
     * @param table Table
     * @param patterns Patterns in priority order
     * @return Warnings in column order
     */
    public List<String> detect(Table table, List<SensitivePattern> patterns) {
        List<String> warnings = new ArrayList<>();
        if (patterns == null || patterns.isEmpty() || table.getColumns() == null) {
            return warnings;
        }
        for (Column column : table.getColumns()) {
            for (SensitivePattern pattern : patterns) {
                if (pattern.matches(column.getName())) {
                    warnings.add(String.format("Column '%s' may contain sensitive data: %s",
                            column.getName(), pattern.getDescription()));
                    break;
                }
            }
        }
        return warnings;
    }
}

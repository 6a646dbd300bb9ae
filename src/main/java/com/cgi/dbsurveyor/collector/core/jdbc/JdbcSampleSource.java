package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.service.sampling.SampleSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Sample source running ordered, limited SELECTs over JDBC.
 * Each query gets its own template so the sampling timeout applies to that query only.
 */
@Slf4j
public class JdbcSampleSource implements SampleSource {

    private static final int FETCH_SIZE = 500;

    private final DataSource dataSource;
    private final SqlDialect dialect;

    /**
     * Constructor.
     *
     * @param dataSource Data source of the adapter
     * @param dialect SQL dialect
     */
    public JdbcSampleSource(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    @Override
    public String systemRowIdColumn(Table table) {
        return dialect == SqlDialect.SQLITE ? "rowid" : null;
    }

    @Override
    public void fetchRows(Table table, OrderingStrategy strategy, int limit, Duration timeout,
                          Consumer<Map<String, Object>> rowConsumer) {
        String sql = "SELECT * FROM " + dialect.qualify(table.getSchema(), table.getName())
                + " " + dialect.orderByClause(strategy) + " LIMIT ?";
        JdbcTemplate jdbc = template(timeout, limit);
        SampleRowMapper mapper = new SampleRowMapper(dialect);
        try {
            log.debug("Executing sampling query: {}", sql);
            jdbc.query(sql, (RowCallbackHandler) rs -> rowConsumer.accept(mapper.mapRow(rs, rs.getRow())), limit);
        } catch (DataAccessException e) {
            throw JdbcErrorTranslator.translate("sampling " + table.getName(), e);
        }
    }

    @Override
    public Long countRows(Table table, Duration timeout) {
        String sql = "SELECT COUNT(*) FROM " + dialect.qualify(table.getSchema(), table.getName());
        try {
            return template(timeout, 1).queryForObject(sql, Long.class);
        } catch (DataAccessException e) {
            throw JdbcErrorTranslator.translate("counting " + table.getName(), e);
        }
    }

    private JdbcTemplate template(Duration timeout, int maxRows) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
        jdbc.setMaxRows(maxRows);
        jdbc.setFetchSize(Math.min(FETCH_SIZE, maxRows));
        return jdbc;
    }
}

package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.ConnectionTimeoutException;
import com.cgi.dbsurveyor.collector.exception.InsufficientPrivilegeException;
import com.cgi.dbsurveyor.collector.exception.QueryTimeoutException;
import org.springframework.dao.PermissionDeniedDataAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.Set;

/**
 * Maps JDBC and Spring data-access failures onto the collector error taxonomy.
 * Messages are sanitized; the original exception is kept as cause.
 */
public final class JdbcErrorTranslator {

    /**
     * MySQL vendor codes for access denied on database, table and privilege checks.
     */
    private static final Set<Integer> MYSQL_PRIVILEGE_CODES = Set.of(1044, 1142, 1227);

    private JdbcErrorTranslator() {
    }

    /**
     * Translates a failure.
     *
     * @param operation Operation name, used in the message
     * @param failure Failure
     * @return Taxonomy exception
     */
    public static BaseException translate(String operation, Throwable failure) {
        if (failure instanceof BaseException) {
            return (BaseException) failure;
        }
        String detail = CredentialSanitizer.describe(rootCause(failure));

        if (failure instanceof org.springframework.dao.QueryTimeoutException) {
            return new QueryTimeoutException("Query timed out during " + operation, failure);
        }
        if (failure instanceof PermissionDeniedDataAccessException) {
            return new InsufficientPrivilegeException("Insufficient privileges for " + operation + ": " + detail, failure);
        }

        // Vendor state wins over a generic pool timeout wrapping it
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SQLTimeoutException) {
                return new QueryTimeoutException("Query timed out during " + operation, failure);
            }
            if (t instanceof SQLException && !(t instanceof SQLTransientConnectionException)) {
                BaseException translated = fromSqlState(operation, (SQLException) t, failure, detail);
                if (translated != null) {
                    return translated;
                }
            }
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || (t instanceof SQLTransientConnectionException && isTimeoutMessage(t.getMessage()))) {
                return new ConnectionTimeoutException("Connection timed out during " + operation, failure);
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return new ConnectionFailedException("Connection failed during " + operation + ": " + detail, failure);
            }
        }
        return new CollectionException("Error during " + operation + ": " + detail, failure);
    }

    private static BaseException fromSqlState(String operation, SQLException e, Throwable failure, String detail) {
        String state = e.getSQLState();
        if (MYSQL_PRIVILEGE_CODES.contains(e.getErrorCode()) || "42501".equals(state)) {
            return new InsufficientPrivilegeException("Insufficient privileges for " + operation + ": " + detail, failure);
        }
        if (state == null) {
            return null;
        }
        if ("57014".equals(state)) {
            return new QueryTimeoutException("Query cancelled or timed out during " + operation, failure);
        }
        if (state.startsWith("28")) {
            return new ConnectionFailedException("Authentication failed", failure);
        }
        if (state.startsWith("08")) {
            return isTimeoutMessage(e.getMessage())
                    ? new ConnectionTimeoutException("Connection timed out during " + operation, failure)
                    : new ConnectionFailedException("Connection failed during " + operation + ": " + detail, failure);
        }
        return null;
    }

    private static boolean isTimeoutMessage(String message) {
        return message != null && message.toLowerCase(Locale.ROOT).contains("timed out");
    }

    private static Throwable rootCause(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }
}

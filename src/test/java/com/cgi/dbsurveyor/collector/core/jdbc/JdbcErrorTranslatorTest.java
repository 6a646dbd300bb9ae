package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.ConnectionTimeoutException;
import com.cgi.dbsurveyor.collector.exception.InsufficientPrivilegeException;
import com.cgi.dbsurveyor.collector.exception.QueryTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.net.ConnectException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcErrorTranslatorTest {

    private static UncategorizedSQLException wrap(SQLException e) {
        return new UncategorizedSQLException("query", "SELECT 1", e);
    }

    @Test
    void testPermissionDenied() {
        BaseException e = JdbcErrorTranslator.translate("list tables",
                wrap(new SQLException("permission denied for table secrets", "42501")));

        assertTrue(e instanceof InsufficientPrivilegeException);
        assertFalse(e.isConnectionError());
    }

    @Test
    void testMySqlAccessDeniedVendorCode() {
        BaseException e = JdbcErrorTranslator.translate("list tables",
                wrap(new SQLException("Access denied for user", "42000", 1142)));

        assertTrue(e instanceof InsufficientPrivilegeException);
    }

    @Test
    void testStatementTimeouts() {
        assertTrue(JdbcErrorTranslator.translate("sample",
                wrap(new SQLException("canceling statement due to statement timeout", "57014")))
                instanceof QueryTimeoutException);
        assertTrue(JdbcErrorTranslator.translate("sample", wrap(new SQLTimeoutException("timeout")))
                instanceof QueryTimeoutException);
        assertTrue(JdbcErrorTranslator.translate("sample",
                new org.springframework.dao.QueryTimeoutException("timeout"))
                instanceof QueryTimeoutException);
    }

    @Test
    void testAuthenticationFailureHidesDriverText() {
        BaseException e = JdbcErrorTranslator.translate("connect",
                new SQLException("password authentication failed for user \"admin\"", "28P01"));

        assertTrue(e instanceof ConnectionFailedException);
        assertTrue(e.isConnectionError());
        assertEquals("Authentication failed", e.getMessage());
    }

    @Test
    void testPoolTimeoutIsConnectionTimeout() {
        BaseException e = JdbcErrorTranslator.translate("connect", new DataAccessResourceFailureException("pool",
                new SQLTransientConnectionException("dbsurveyor-1 - Connection is not available, request timed out after 30000ms.")));

        assertTrue(e instanceof ConnectionTimeoutException);
    }

    @Test
    void testRefusedConnection() {
        BaseException e = JdbcErrorTranslator.translate("connect",
                new SQLException("Connection attempt failed", "08001", new ConnectException("Connection refused")));

        assertTrue(e instanceof ConnectionFailedException);
    }

    @Test
    void testUnknownFailureIsSanitized() {
        BaseException e = JdbcErrorTranslator.translate("describe",
                new IllegalStateException("bad url postgres://admin:hunter2@db:5432/app"));

        assertTrue(e instanceof CollectionException);
        assertFalse(e.getMessage().contains("hunter2"));
        assertTrue(e.getMessage().contains("postgres://admin:****@db:5432/app"));
    }

    @Test
    void testTaxonomyExceptionPassesThrough() {
        QueryTimeoutException original = new QueryTimeoutException("already translated");

        assertSame(original, JdbcErrorTranslator.translate("op", original));
    }
}

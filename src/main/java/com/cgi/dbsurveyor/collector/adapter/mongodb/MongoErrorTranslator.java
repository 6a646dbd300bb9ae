package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.ConnectionTimeoutException;
import com.cgi.dbsurveyor.collector.exception.InsufficientPrivilegeException;
import com.cgi.dbsurveyor.collector.exception.QueryTimeoutException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;

/**
 * Maps MongoDB driver failures onto the collector error taxonomy.
 */
final class MongoErrorTranslator {

    /**
     * Server error code for "Unauthorized".
     */
    private static final int UNAUTHORIZED = 13;

    private MongoErrorTranslator() {
    }

    static BaseException translate(String operation, RuntimeException failure) {
        if (failure instanceof BaseException) {
            return (BaseException) failure;
        }
        if (failure instanceof MongoSecurityException) {
            return new ConnectionFailedException("Authentication failed", failure);
        }
        if (failure instanceof MongoTimeoutException || failure instanceof MongoSocketReadTimeoutException) {
            return new ConnectionTimeoutException("Connection timed out during " + operation, failure);
        }
        if (failure instanceof MongoExecutionTimeoutException) {
            return new QueryTimeoutException("Query timed out during " + operation, failure);
        }
        if (failure instanceof MongoSocketException) {
            return new ConnectionFailedException("Connection failed during " + operation, failure);
        }
        String detail = CredentialSanitizer.describe(failure);
        if (failure instanceof MongoCommandException && ((MongoCommandException) failure).getErrorCode() == UNAUTHORIZED) {
            return new InsufficientPrivilegeException("Insufficient privileges for " + operation + ": " + detail, failure);
        }
        return new CollectionException("Error during " + operation + ": " + detail, failure);
    }
}

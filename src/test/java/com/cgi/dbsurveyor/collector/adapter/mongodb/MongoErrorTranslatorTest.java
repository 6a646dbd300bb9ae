package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.ConnectionTimeoutException;
import com.cgi.dbsurveyor.collector.exception.InsufficientPrivilegeException;
import com.cgi.dbsurveyor.collector.exception.QueryTimeoutException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoCredential;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketOpenException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ServerAddress;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MongoErrorTranslatorTest {

    private static MongoCommandException commandFailure(int code, String message) {
        BsonDocument response = new BsonDocument("ok", new BsonDouble(0))
                .append("code", new BsonInt32(code))
                .append("errmsg", new BsonString(message));
        return new MongoCommandException(response, new ServerAddress("db.local", 27017));
    }

    @Test
    void testAuthenticationFailureHidesCredentials() {
        MongoCredential credential = MongoCredential.createScramSha256Credential("svc", "admin", "s3cr3t".toCharArray());

        BaseException translated = MongoErrorTranslator.translate("ping",
                new MongoSecurityException(credential, "Exception authenticating"));

        assertInstanceOf(ConnectionFailedException.class, translated);
        assertTrue(translated.isConnectionError());
        assertFalse(translated.getMessage().contains("s3cr3t"));
    }

    @Test
    void testServerSelectionTimeout() {
        BaseException translated = MongoErrorTranslator.translate("ping", new MongoTimeoutException("Timed out"));

        assertInstanceOf(ConnectionTimeoutException.class, translated);
    }

    @Test
    void testSocketFailure() {
        BaseException translated = MongoErrorTranslator.translate("ping",
                new MongoSocketOpenException("Exception opening socket", new ServerAddress("db.local", 27017)));

        assertInstanceOf(ConnectionFailedException.class, translated);
    }

    @Test
    void testExecutionTimeout() {
        BaseException translated = MongoErrorTranslator.translate("sampling orders",
                new MongoExecutionTimeoutException(50, "operation exceeded time limit"));

        assertInstanceOf(QueryTimeoutException.class, translated);
        assertFalse(translated.isConnectionError());
    }

    @Test
    void testUnauthorizedCommand() {
        BaseException translated = MongoErrorTranslator.translate("listCollections", commandFailure(13, "not authorized"));

        assertInstanceOf(InsufficientPrivilegeException.class, translated);
    }

    @Test
    void testOtherCommandFailure() {
        BaseException translated = MongoErrorTranslator.translate("listCollections", commandFailure(2, "bad value"));

        assertInstanceOf(CollectionException.class, translated);
        assertTrue(translated.getMessage().startsWith("Error during listCollections"));
    }

    @Test
    void testTaxonomyExceptionPassesThrough() {
        QueryTimeoutException original = new QueryTimeoutException("already translated");

        assertSame(original, MongoErrorTranslator.translate("x", original));
    }
}

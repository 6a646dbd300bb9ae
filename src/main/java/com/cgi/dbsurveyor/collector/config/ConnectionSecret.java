package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;

import java.util.Arrays;

/**
 * Password holder. Not serializable, masked in {@code toString()}, and wiped
 * with {@link #destroy()} once the connection pool has been created.
 */
public final class ConnectionSecret {

    private final char[] password;
    private volatile boolean destroyed;

    private ConnectionSecret(char[] password) {
        this.password = password;
    }

    /**
     * Wraps a password. The array is copied.
     *
     * @param password Password characters, may be null
     * @return Secret
     */
    public static ConnectionSecret of(char[] password) {
        return new ConnectionSecret(password == null ? new char[0] : password.clone());
    }

    public static ConnectionSecret of(String password) {
        return new ConnectionSecret(password == null ? new char[0] : password.toCharArray());
    }

    public static ConnectionSecret none() {
        return new ConnectionSecret(new char[0]);
    }

    /**
     * Gets the password for handing to a driver.
     *
     * @return Password, null when empty
     * @throws IllegalStateException If the secret was destroyed
     */
    public String reveal() {
        if (destroyed) {
            throw new IllegalStateException("Connection secret has been destroyed");
        }
        return password.length == 0 ? null : new String(password);
    }

    public boolean isEmpty() {
        return password.length == 0;
    }

    /**
     * Overwrites the password characters.
     */
    public void destroy() {
        Arrays.fill(password, '\0');
        destroyed = true;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return CredentialSanitizer.MASK;
    }
}

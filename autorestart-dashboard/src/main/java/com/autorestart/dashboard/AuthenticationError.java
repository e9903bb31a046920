package com.autorestart.dashboard;

/**
 * Login was rejected, returned no token, or the login endpoint could not be
 * reached. Also raised when a request is still unauthorized after one re-login.
 */
public class AuthenticationError extends DashboardError {

    public AuthenticationError(String message, Integer status) {
        super(message, status);
    }

    public AuthenticationError(String message, Integer status, Throwable cause) {
        super(message, status, cause);
    }
}

package io.feedpercolator.api.exception;

public enum ErrorCategory {
    TIMEOUT,              // Connection timeout
    CONNECTION_REFUSED,   // Connection refused
    DNS_ERROR,           // Unknown host
    NETWORK_ERROR,       // Other network issues
    IO_ERROR,            // I/O problems
    INVALID_URL,         // Malformed or non-http URL
    NOT_FOUND,           // 404 error
    ACCESS_FORBIDDEN,    // 403 error
    AUTH_REQUIRED,       // 401 error
    SERVER_ERROR,        // 500 error
    SERVER_UNAVAILABLE,  // 502, 503, 504
    HTTP_ERROR,          // Other HTTP errors
    PARSE_ERROR,         // Malformed XML or unsupported feed format
    RATE_LIMITED,        // 429 Too Many Requests
    FILTER_ERROR,        // A filter threw
    OUTPUT_ERROR,        // Serializing or persisting the merged feed failed
    UNKNOWN;             // Unexpected errors

    public boolean isSourceError() {
        return this != FILTER_ERROR && this != OUTPUT_ERROR;
    }
}

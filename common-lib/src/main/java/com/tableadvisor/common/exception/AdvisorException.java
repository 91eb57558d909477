package com.tableadvisor.common.exception;

/**
 * Boundary failure tied to one advisor session, such as frame bytes that do not decode.
 * The core itself never throws; this is raised only by the service around it.
 */
public class AdvisorException extends RuntimeException {
    private final String sessionId;

    public AdvisorException(String sessionId, String message) {
        super("[" + sessionId + "] " + message);
        this.sessionId = sessionId;
    }

    public AdvisorException(String sessionId, String message, Throwable cause) {
        super("[" + sessionId + "] " + message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

package com.umitunal.hybridq.core;

/**
 * Categories of failure reported by the daemon, its client and its collaborators.
 */
public enum ErrorKind {
    INVALID_REQUEST,     // Malformed or empty submission fields
    NOT_FOUND,           // Unknown job id
    INVALID_TRANSITION,  // State machine violation
    PROTOCOL_ERROR,      // Framing or decoding failure
    TLS_ERROR,           // Handshake or certificate verification failure
    PROCESS_ERROR,       // Spawn or wait failure of a job or notify command
    CONFIG_CONFLICT,     // Mutually exclusive or missing options
    ALREADY_RUNNING      // PID file is locked by another daemon
}

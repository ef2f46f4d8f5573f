package com.gatekeeper.middleware;

// RECEIVED -> DOS_CHECK -> RATE_CHECK -> ALLOWED | BLOCKED
public enum AdmissionStage {
    RECEIVED,
    DOS_CHECK,
    RATE_CHECK,
    ALLOWED,
    BLOCKED
}

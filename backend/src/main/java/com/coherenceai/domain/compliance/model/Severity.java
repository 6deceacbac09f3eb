package com.coherenceai.domain.compliance.model;

/**
 * VIOLATION blocks compliance, WARNING is reported only.
 */
public enum Severity {
    WARNING,
    VIOLATION
}

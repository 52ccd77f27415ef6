/* (C)2026 */
package com.ammann.updatetracker.model;

/** Lifecycle state of a {@link RunRecord}. */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}

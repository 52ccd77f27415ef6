/* (C)2026 */
package com.ammann.updatetracker.model;

/** What started a run. */
public enum RunTrigger {
    MANUAL,
    SCHEDULED
}

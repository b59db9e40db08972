package com.wakeengine.service.loop;

/**
 * Terminal state of one adaptation tick.
 *
 * <ul>
 *   <li>{@code APPLIED}  – target time moved, record appended, notifier called</li>
 *   <li>{@code SKIPPED}  – nothing to do (no sleep data, below threshold, already at target)</li>
 *   <li>{@code FAILED}   – a collaborator failed or timed out; target untouched</li>
 *   <li>{@code DISABLED} – real-time adaptation is off (or was switched off mid-tick)</li>
 * </ul>
 */
public enum TickState {
    APPLIED,
    SKIPPED,
    FAILED,
    DISABLED
}

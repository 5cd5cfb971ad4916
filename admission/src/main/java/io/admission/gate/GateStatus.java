package io.admission.gate;

/** Point-in-time view of a gate for monitoring. */
public record GateStatus(int available, int waiting) {
}

package com.bridgerelay.relay.job;

import com.bridgerelay.domain.ScanWindow;

/**
 * Outcome of one relay cycle.
 *
 * @param window         scanned window; null when the cycle stopped before scanning
 * @param committedBlock last scanned block after the cycle (unchanged when nothing was committed)
 * @param failed         true when the cycle hit a transient, submission or storage failure
 */
public record CycleReport(
        long cycle,
        RelayState finalState,
        ScanWindow window,
        int submitted,
        int skipped,
        int malformed,
        int rejected,
        long committedBlock,
        boolean failed
) {

    @Override
    public String toString() {
        return "cycle=" + cycle + " state=" + finalState + " window=" + window
                + " submitted=" + submitted + " skipped=" + skipped + " malformed=" + malformed
                + " rejected=" + rejected + " lastScannedBlock=" + committedBlock + (failed ? " FAILED" : "");
    }
}

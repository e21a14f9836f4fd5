package watchtower.monitor.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution lifecycle status. Transitions into a terminal status are one-way.
 */
public enum ExecutionStatus {
    /** Created by an operator, runner has not picked it up yet */
    MANUALLY_STARTED,
    /** Runner reported start */
    RUNNING,
    /** Stop was requested, waiting for the runner to finish */
    STOPPING,
    /** Finished successfully */
    SUCCEEDED,
    /** Finished with an error */
    FAILED,
    /** Ran past its maximum age */
    TIMED_OUT,
    /** Stopped by an operator or by a redeploy */
    ABORTED,
    /** Given up on by the health checker */
    ABANDONED;

    public static final Set<ExecutionStatus> IN_PROGRESS =
            EnumSet.of(MANUALLY_STARTED, RUNNING, STOPPING);

    public boolean isTerminal() {
        return !IN_PROGRESS.contains(this);
    }
}

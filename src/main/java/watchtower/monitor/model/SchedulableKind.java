package watchtower.monitor.model;

/**
 * Kind of schedulable entity.
 */
public enum SchedulableKind {
    /** A single task, possibly a long-running service */
    TASK,
    /** A workflow of tasks */
    WORKFLOW
}

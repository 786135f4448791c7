package io.hookforge;

import java.time.Instant;

/**
 * Immutable metadata for a task spawned by a run.
 */
public final class TaskInfo {

    private final long runId;
    private final long taskId;
    private final String name;
    private final TaskKind kind;
    private final int hookIndex;
    private final Instant createdAt;
    private final String schedulerName;

    public TaskInfo(long runId, long taskId, String name, TaskKind kind, int hookIndex, Instant createdAt, String schedulerName) {
        this.runId = runId;
        this.taskId = taskId;
        this.name = name;
        this.kind = kind;
        this.hookIndex = hookIndex;
        this.createdAt = createdAt;
        this.schedulerName = schedulerName;
    }

    public long runId() {
        return runId;
    }

    public long taskId() {
        return taskId;
    }

    public String name() {
        return name;
    }

    public TaskKind kind() {
        return kind;
    }

    /**
     * @return position of the hook in the registry, or -1 for the signal listener.
     */
    public int hookIndex() {
        return hookIndex;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String schedulerName() {
        return schedulerName;
    }

    @Override
    public String toString() {
        return name + "#" + runId + "." + taskId;
    }
}

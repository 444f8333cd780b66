package adlab.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the mutable state tracked for one task id.
 * The store owns the live row; every write there yields a new snapshot
 * with a higher {@link #version()}.
 */
public final class TaskRecord {
    private final String id;
    private final TaskType type;
    private final String payload; // JSON input
    private final TaskStatus status;
    private final String progress;
    private final String result; // JSON, only when COMPLETED
    private final TaskError error; // only when FAILED
    private final int attempts;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TaskRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress;
        this.result = builder.result;
        this.error = builder.error;
        this.attempts = builder.attempts;
        this.version = builder.version;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;

        if (result != null && error != null) {
            throw new IllegalStateException("result and error are mutually exclusive: " + id);
        }
    }

    public String id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    public String payload() {
        return payload;
    }

    public TaskStatus status() {
        return status;
    }

    public String progress() {
        return progress;
    }

    public String result() {
        return result;
    }

    public TaskError error() {
        return error;
    }

    public int attempts() {
        return attempts;
    }

    public long version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Fresh PENDING record for a new submission. */
    public static TaskRecord pending(String id, TaskType type, String payload, Instant now) {
        return builder()
                .id(id)
                .type(type)
                .payload(payload)
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .payload(payload)
                .status(status)
                .progress(progress)
                .result(result)
                .error(error)
                .attempts(attempts)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskType type;
        private String payload;
        private TaskStatus status = TaskStatus.PENDING;
        private String progress;
        private String result;
        private TaskError error;
        private int attempts = 0;
        private long version = 1;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(String progress) {
            this.progress = progress;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(TaskError error) {
            this.error = error;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRecord other))
            return false;
        return Objects.equals(id, other.id) && version == other.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "TaskRecord{id='" + id + "', type=" + type + ", status=" + status
                + ", attempts=" + attempts + ", version=" + version + "}";
    }
}

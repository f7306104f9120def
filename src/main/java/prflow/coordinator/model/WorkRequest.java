package prflow.coordinator.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable snapshot of one automation job.
 * Job parameters never change after submission; lifecycle fields are rewritten
 * by the queue on claim, report and reclaim.
 */
public final class WorkRequest {
    private final String id;
    private final Instant createdAt;
    private final String createdBy;
    private final RequestType requestType;
    private final RequestStatus status;
    private final String branchName;
    private final String prTitle;
    private final String prDescription;
    private final String targetBranch;
    private final String fileName;
    private final byte[] payload;
    private final String stagePath;
    private final int priority;
    private final int retryCount;
    private final int maxRetries;
    private final String processorId; // claim holder, null unless PROCESSING
    private final Instant processedAt;
    private final String errorMessage;
    private final String githubBranchUrl;
    private final String githubPrUrl;
    private final Integer githubPrNumber;

    private WorkRequest(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.createdAt = builder.createdAt;
        this.createdBy = builder.createdBy;
        this.requestType = Objects.requireNonNull(builder.requestType, "requestType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.branchName = builder.branchName;
        this.prTitle = builder.prTitle;
        this.prDescription = builder.prDescription;
        this.targetBranch = builder.targetBranch;
        this.fileName = builder.fileName;
        this.payload = builder.payload != null ? builder.payload.clone() : new byte[0];
        this.stagePath = builder.stagePath;
        this.priority = builder.priority;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.processorId = builder.processorId;
        this.processedAt = builder.processedAt;
        this.errorMessage = builder.errorMessage;
        this.githubBranchUrl = builder.githubBranchUrl;
        this.githubPrUrl = builder.githubPrUrl;
        this.githubPrNumber = builder.githubPrNumber;
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String createdBy() {
        return createdBy;
    }

    public RequestType requestType() {
        return requestType;
    }

    public RequestStatus status() {
        return status;
    }

    public String branchName() {
        return branchName;
    }

    public String prTitle() {
        return prTitle;
    }

    public String prDescription() {
        return prDescription;
    }

    public String targetBranch() {
        return targetBranch;
    }

    public String fileName() {
        return fileName;
    }

    /** Opaque file content; returns a copy. */
    public byte[] payload() {
        return payload.clone();
    }

    /** Payload decoded as UTF-8, for text-based generators. */
    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public String stagePath() {
        return stagePath;
    }

    public int priority() {
        return priority;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String processorId() {
        return processorId;
    }

    public Instant processedAt() {
        return processedAt;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String githubBranchUrl() {
        return githubBranchUrl;
    }

    public String githubPrUrl() {
        return githubPrUrl;
    }

    public Integer githubPrNumber() {
        return githubPrNumber;
    }

    /** Create a builder from this request (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .createdAt(createdAt)
                .createdBy(createdBy)
                .requestType(requestType)
                .status(status)
                .branchName(branchName)
                .prTitle(prTitle)
                .prDescription(prDescription)
                .targetBranch(targetBranch)
                .fileName(fileName)
                .payload(payload)
                .stagePath(stagePath)
                .priority(priority)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .processorId(processorId)
                .processedAt(processedAt)
                .errorMessage(errorMessage)
                .githubBranchUrl(githubBranchUrl)
                .githubPrUrl(githubPrUrl)
                .githubPrNumber(githubPrNumber);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Instant createdAt;
        private String createdBy;
        private RequestType requestType = RequestType.CREATE_PR;
        private RequestStatus status = RequestStatus.PENDING;
        private String branchName;
        private String prTitle;
        private String prDescription;
        private String targetBranch;
        private String fileName;
        private byte[] payload;
        private String stagePath;
        private int priority = 5;
        private int retryCount = 0;
        private int maxRetries = 3;
        private String processorId;
        private Instant processedAt;
        private String errorMessage;
        private String githubBranchUrl;
        private String githubPrUrl;
        private Integer githubPrNumber;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder requestType(RequestType requestType) {
            this.requestType = requestType;
            return this;
        }

        public Builder status(RequestStatus status) {
            this.status = status;
            return this;
        }

        public Builder branchName(String branchName) {
            this.branchName = branchName;
            return this;
        }

        public Builder prTitle(String prTitle) {
            this.prTitle = prTitle;
            return this;
        }

        public Builder prDescription(String prDescription) {
            this.prDescription = prDescription;
            return this;
        }

        public Builder targetBranch(String targetBranch) {
            this.targetBranch = targetBranch;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder stagePath(String stagePath) {
            this.stagePath = stagePath;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder processorId(String processorId) {
            this.processorId = processorId;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder githubBranchUrl(String githubBranchUrl) {
            this.githubBranchUrl = githubBranchUrl;
            return this;
        }

        public Builder githubPrUrl(String githubPrUrl) {
            this.githubPrUrl = githubPrUrl;
            return this;
        }

        public Builder githubPrNumber(Integer githubPrNumber) {
            this.githubPrNumber = githubPrNumber;
            return this;
        }

        public WorkRequest build() {
            return new WorkRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkRequest request))
            return false;
        return Objects.equals(id, request.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkRequest{id='" + id + "', branch='" + branchName + "', status=" + status
                + ", retry=" + retryCount + "/" + maxRetries + ", processor='" + processorId
                + "', payloadBytes=" + payload.length + "}";
    }

    /** Content equality of the payload, used by tests and idempotency checks. */
    public boolean samePayload(byte[] other) {
        return Arrays.equals(payload, other);
    }
}

package prflow.coordinator.model;

/**
 * Parameters of a submission.
 * {@code targetBranch}, {@code priority} and {@code maxRetries} may be left
 * null to take the queue defaults.
 */
public record NewRequest(
        String branchName,
        String prTitle,
        String prDescription,
        String targetBranch,
        String fileName,
        byte[] payload,
        String createdBy,
        Integer priority,
        Integer maxRetries) {

    public static final String DEFAULT_TARGET_BRANCH = "main";
    public static final int DEFAULT_PRIORITY = 5;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    // column widths
    public static final int MAX_BRANCH_LENGTH = 512;
    public static final int MAX_TITLE_LENGTH = 1024;
    public static final int MAX_FILE_NAME_LENGTH = 1024;
    public static final int MAX_CREATED_BY_LENGTH = 256;

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String branchName;
        private String prTitle;
        private String prDescription;
        private String targetBranch;
        private String fileName;
        private byte[] payload;
        private String createdBy;
        private Integer priority;
        private Integer maxRetries;

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

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public NewRequest build() {
            return new NewRequest(branchName, prTitle, prDescription, targetBranch, fileName, payload,
                    createdBy, priority, maxRetries);
        }
    }
}

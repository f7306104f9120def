package prflow.coordinator.worker;

import prflow.coordinator.model.WorkRequest;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds pull request bodies.
 */
public final class PullRequestDescriptions {

    static final String DEFAULT_BODY = "Automated configuration update";

    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private PullRequestDescriptions() {
    }

    /**
     * The request's description, or a default body when it has none, followed by
     * a footer identifying the request.
     */
    public static String build(WorkRequest request) {
        String body = request.prDescription() == null || request.prDescription().isBlank()
                ? DEFAULT_BODY
                : request.prDescription();

        StringBuilder sb = new StringBuilder(body);
        sb.append("\n\n---\n");
        sb.append("**Automated PR Details:**\n");
        sb.append("- Created by: ").append(request.createdBy()).append('\n');
        sb.append("- Request ID: `").append(request.id()).append("`\n");
        sb.append("- Priority: ").append(request.priority()).append('\n');
        if (request.createdAt() != null) {
            sb.append("- Created: ").append(CREATED_FORMAT.format(request.createdAt())).append('\n');
        }
        sb.append("- File: `").append(request.fileName()).append("`\n");
        sb.append('\n');
        sb.append("This PR was automatically created by the prflow queue worker.\n");
        return sb.toString();
    }
}

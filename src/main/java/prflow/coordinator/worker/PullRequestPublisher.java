package prflow.coordinator.worker;

import prflow.coordinator.model.WorkRequest;

/**
 * Client of the code hosting service.
 * Creates the branch, commits the request's file and opens the pull request.
 */
public interface PullRequestPublisher {

    /**
     * Publish one request.
     *
     * @param request     the claimed request
     * @param description pull request body
     * @return identifiers of what was created
     * @throws PublishException if any step fails
     */
    PublishedPullRequest publish(WorkRequest request, String description) throws PublishException;
}

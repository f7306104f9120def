package prflow.coordinator.worker;

/**
 * Identifiers returned by the hosting service after a pull request is opened.
 *
 * @param branchUrl web URL of the pushed branch
 * @param prUrl     web URL of the pull request
 * @param prNumber  pull request number
 */
public record PublishedPullRequest(String branchUrl, String prUrl, Integer prNumber) {
}

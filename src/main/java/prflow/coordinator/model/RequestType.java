package prflow.coordinator.model;

/**
 * Kind of automation job carried by a request.
 */
public enum RequestType {
    /** Create a branch, commit one generated file and open a pull request */
    CREATE_PR
}

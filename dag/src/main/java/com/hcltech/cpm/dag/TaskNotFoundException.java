package com.hcltech.cpm.dag;

public class TaskNotFoundException extends CpmException {
    public TaskNotFoundException(String identifier) {
        super(ErrorKind.NOT_FOUND, identifier, "Task not found: " + identifier);
    }

    /** Unknown identifier referenced as a dependency of {@code referencedBy}. */
    public TaskNotFoundException(String identifier, String referencedBy) {
        super(ErrorKind.NOT_FOUND, identifier,
                "Task not found: " + identifier + " (dependency of " + referencedBy + ")");
    }
}

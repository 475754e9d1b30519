package com.herzen.prereq.graph;

public class PrerequisiteNotFoundException extends RuntimeException {
    private final long prerequisiteId;

    public PrerequisiteNotFoundException(long prerequisiteId) {
        super("Prerequisite not found: " + prerequisiteId);
        this.prerequisiteId = prerequisiteId;
    }

    public long getPrerequisiteId() {
        return prerequisiteId;
    }
}

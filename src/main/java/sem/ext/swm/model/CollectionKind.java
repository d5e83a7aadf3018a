package sem.ext.swm.model;

/**
 * The two kinds of collection the discovery engine produces.
 */
public enum CollectionKind {
    /** Same scene at increasing magnification, each frame inside the previous one. */
    PYRAMID("MagGrid"),
    /** Same scene captured with different detector modes. */
    MODE_GRID("ModeGrid");

    private final String workflowName;

    CollectionKind(String workflowName) {
        this.workflowName = workflowName;
    }

    /**
     * @return the name the workflow panel shows for this kind
     */
    public String getWorkflowName() {
        return workflowName;
    }
}

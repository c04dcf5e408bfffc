package io.autolv.panel;

/**
 * The fixed set of control variants a declared LabVIEW type can map to.
 */
public enum ControlKind {
    NUMERIC("Numeric"),
    BOOLEAN("Boolean"),
    STRING("String"),
    PATH("Path"),
    TIMESTAMP("Time Stamp"),
    ENUM("Enum"),
    IVI_LOGICAL_NAME("IVI Logical Name"),
    VISA_RESOURCE_NAME("VISA Resource Name"),
    SHARED_VARIABLE("Shared Variable"),
    USER_DEFINED_REFNUM("User Defined Refnum"),
    RING("Ring"),
    ARRAY("Array"),
    CLUSTER("Cluster"),
    ARRAY_CLUSTER("Array of Clusters"),
    WAVEFORM_GRAPH("Waveform Graph"),
    TAB_CONTROL("Tab Control"),
    UNSUPPORTED("Unsupported");

    private final String label;

    ControlKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * I/O refnum kinds share one behaviour and differ only by this tag.
     */
    public boolean isIoRefNum() {
        return this == IVI_LOGICAL_NAME
            || this == VISA_RESOURCE_NAME
            || this == SHARED_VARIABLE
            || this == USER_DEFINED_REFNUM;
    }
}

package com.cybershieldx.agent.scan;

/**
 * One probe of a scan pipeline and the report section it fills
 */
public final class ScanStep {
    private final String section;
    private final Probe probe;
    private final ScanDepth depth;

    public ScanStep(String section, Probe probe, ScanDepth depth) {
        this.section = section;
        this.probe = probe;
        this.depth = depth;
    }

    public String getSection() {
        return section;
    }

    public Probe getProbe() {
        return probe;
    }

    public ScanDepth getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return section + "(" + probe + ", " + depth + ")";
    }
}

package com.cybershieldx.agent.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Scan types and their probe pipelines. Every pipeline starts with system information.
 */
public enum ScanType {
    QUICK(List.of(
            new ScanStep("system", Probe.SYSTEM_INFO, ScanDepth.BASIC),
            new ScanStep("openPorts", Probe.COMMON_PORTS, ScanDepth.BASIC))),
    SYSTEM(List.of(
            new ScanStep("system", Probe.SYSTEM_INFO, ScanDepth.DETAILED),
            new ScanStep("configuration", Probe.CONFIGURATION, ScanDepth.DETAILED),
            new ScanStep("vulnerabilities", Probe.LOCAL_VULNERABILITIES, ScanDepth.DETAILED),
            new ScanStep("malware", Probe.MALWARE, ScanDepth.DETAILED))),
    NETWORK(List.of(
            new ScanStep("system", Probe.SYSTEM_INFO, ScanDepth.BASIC),
            new ScanStep("devices", Probe.DEVICE_DISCOVERY, ScanDepth.DETAILED),
            new ScanStep("services", Probe.SERVICES, ScanDepth.DETAILED),
            new ScanStep("firewall", Probe.FIREWALL, ScanDepth.DETAILED),
            new ScanStep("networkVulnerabilities", Probe.NETWORK_VULNERABILITIES, ScanDepth.DETAILED))),
    FULL(fullPipeline());

    private final List<ScanStep> steps;

    ScanType(List<ScanStep> steps) {
        this.steps = steps;
    }

    public List<ScanStep> steps() {
        return steps;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a wire name, or null when unknown
     */
    public static ScanType fromWire(String name) {
        if (name == null) {
            return null;
        }
        for (ScanType type : values()) {
            if (type.wireName().equals(name.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }

    // System and network probes at maximum depth, system info once
    private static List<ScanStep> fullPipeline() {
        List<ScanStep> steps = new ArrayList<>();
        steps.add(new ScanStep("system", Probe.SYSTEM_INFO, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("configuration", Probe.CONFIGURATION, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("vulnerabilities", Probe.LOCAL_VULNERABILITIES, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("malware", Probe.MALWARE, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("devices", Probe.DEVICE_DISCOVERY, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("services", Probe.SERVICES, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("firewall", Probe.FIREWALL, ScanDepth.MAXIMUM));
        steps.add(new ScanStep("networkVulnerabilities", Probe.NETWORK_VULNERABILITIES, ScanDepth.MAXIMUM));
        return Collections.unmodifiableList(steps);
    }
}

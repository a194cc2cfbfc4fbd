package com.cybershieldx.agent.scan;

/**
 * Probes a scan collaborator can run
 */
public enum Probe {
    SYSTEM_INFO,
    CONFIGURATION,
    LOCAL_VULNERABILITIES,
    MALWARE,
    COMMON_PORTS,
    DEVICE_DISCOVERY,
    SERVICES,
    FIREWALL,
    NETWORK_VULNERABILITIES
}

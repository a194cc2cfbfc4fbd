package com.cybershieldx.agent.scan;

/**
 * How thorough a probe should be
 */
public enum ScanDepth {
    BASIC,
    DETAILED,
    MAXIMUM
}

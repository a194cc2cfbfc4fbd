package com.cybershieldx.agent.command;

import java.time.Duration;

/**
 * Ends the process so the service supervisor can start it again
 */
public interface ProcessControl {

    /**
     * Exit with {@code status} after {@code delay}, giving pending messages time to go out
     */
    void exit(int status, Duration delay);
}

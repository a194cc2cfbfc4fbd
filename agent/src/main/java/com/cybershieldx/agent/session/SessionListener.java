package com.cybershieldx.agent.session;

/**
 * Observer of session state changes
 */
public interface SessionListener {

    void onStateChanged(SessionState previous, SessionState current);
}

package com.workshopos.domain;

import java.util.List;

/**
 * Lifecycle of a workshop session record.
 *
 * STARTING: record committed, cluster resource not yet created.
 * WAITING:  resource exists, waiting for allocation or token activation.
 * RUNNING:  resource exists and is claimed by a user.
 * STOPPING: marked for teardown; the session reaper deletes it.
 */
public enum SessionState {
    STARTING,
    WAITING,
    RUNNING,
    STOPPING;

    /** States counted against environment and portal capacity. */
    public static final List<SessionState> ACTIVE = List.of(STARTING, WAITING, RUNNING);

    /** States an unowned session can be claimed from. */
    public static final List<SessionState> CLAIMABLE = List.of(STARTING, WAITING);
}

package edu.brandeis.cosi103a.gametheory.experiment;

/**
 * Fire-and-forget execution of run workers. {@link #dispatch} returns without waiting for the
 * task; outcomes are observed only through the stored run.
 */
public interface RunDispatcher {

    /**
     * @throws java.util.concurrent.RejectedExecutionException if the task cannot be accepted
     */
    void dispatch(Runnable task);
}

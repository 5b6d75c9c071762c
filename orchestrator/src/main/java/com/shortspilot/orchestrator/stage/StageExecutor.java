package com.shortspilot.orchestrator.stage;

/**
 * One pipeline stage implemented by an external collaborator.
 *
 * The orchestrator treats every stage the same way: it hands over an input,
 * gets an output back or a {@link StageException}. Retries inside a single
 * call (network retry, re-encoding) are the executor's own business.
 *
 * @param <I> input handed over by the scheduler
 * @param <O> opaque success handle
 */
public interface StageExecutor<I, O> {

    Stage stage();

    /**
     * @throws StageException when the stage fails; any other runtime
     *         exception is treated as a transient failure
     */
    O execute(I input) throws StageException;
}

package com.p14n.entitystream.broker;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Executor used for asynchronous message delivery.
 * Abstracted so tests can substitute a deterministic implementation.
 */
public interface AsyncExecutor extends Executor, AutoCloseable {

    List<Runnable> shutdownNow();

}

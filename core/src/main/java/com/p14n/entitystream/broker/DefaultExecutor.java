package com.p14n.entitystream.broker;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a cached thread
 * pool with named daemon threads.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a cached thread pool with named threads.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("entity-stream-delivery-%d")
                                                .setDaemon(true).build());
        }

        @Override
        public void execute(Runnable command) {
                es.execute(command);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        @Override
        public void close() {
                shutdownNow();
        }
}

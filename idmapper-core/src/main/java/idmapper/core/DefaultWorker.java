/* 
 * Copyright (C) 2025 IDMAPPER developers
 *
 * This File is part of IDMAPPER
 *
 * IDMAPPER is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * IDMAPPER is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with IDMAPPER.  If not, see <http://www.gnu.org/licenses/>.
 */
package idmapper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs tasks one at a time on a background daemon thread, with cooperative cancellation and a completion callback.
 */
public class DefaultWorker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DefaultWorker.class);
    protected final ExecutorService executor;
    protected final ProgressCallback progressor;
    protected final AtomicBoolean cancelled = new AtomicBoolean(false);
    protected Runnable endOfWork;

    public DefaultWorker(ProgressCallback progressor) {
        this.progressor = progressor == null ? ProgressCallback.NONE : progressor;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "idmapper-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submits {@code task}. The cancellation flag is cleared before the task starts.
     * @param task task to run
     * @param onDone receives the outcome once the task ended, on the worker thread; may be null
     * @return future of the task result
     */
    public <T> Future<T> execute(WorkerTask<T> task, Consumer<Outcome<T>> onDone) {
        return executor.submit(() -> {
            cancelled.set(false);
            progressor.setRunning(true);
            Outcome<T> outcome = null;
            try {
                T res = task.run(this::isCancelled);
                outcome = Outcome.success(res);
                return res;
            } catch (Exception e) {
                if (isCancelled()) {
                    logger.debug("Cancelled task", e);
                    outcome = Outcome.cancelled(e);
                } else {
                    progressor.log("Error while executing task:" + e);
                    logger.error("Error while executing task", e);
                    outcome = Outcome.failure(e);
                }
                throw e;
            } finally {
                progressor.setRunning(false);
                if (onDone != null && outcome != null) onDone.accept(outcome);
                if (endOfWork != null) endOfWork.run();
            }
        });
    }

    /**
     * Requests cancellation of the running task. Tasks poll the flag between records.
     */
    public void cancel() {
        logger.debug("cancellation requested");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public DefaultWorker setEndOfWork(Runnable endOfWork) {
        this.endOfWork = endOfWork;
        return this;
    }

    @Override
    public void close() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public interface WorkerTask<T> {
        T run(BooleanSupplier cancelled) throws Exception;
    }

    public static class Outcome<T> {
        final T result;
        final Exception error;
        final boolean cancelled;

        private Outcome(T result, Exception error, boolean cancelled) {
            this.result = result;
            this.error = error;
            this.cancelled = cancelled;
        }

        static <T> Outcome<T> success(T result) {
            return new Outcome<>(result, null, false);
        }

        static <T> Outcome<T> failure(Exception error) {
            return new Outcome<>(null, error, false);
        }

        static <T> Outcome<T> cancelled(Exception error) {
            return new Outcome<>(null, error, true);
        }

        public T getResult() {
            return result;
        }

        public Exception getError() {
            return error;
        }

        public boolean isCancelled() {
            return cancelled;
        }

        public boolean isSuccess() {
            return error == null && !cancelled;
        }

        @Override
        public String toString() {
            if (cancelled) return "Outcome{cancelled}";
            return error == null ? "Outcome{"+result+"}" : "Outcome{error="+error+"}";
        }
    }
}

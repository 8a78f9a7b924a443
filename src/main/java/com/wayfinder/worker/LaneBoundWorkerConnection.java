package com.wayfinder.worker;

import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.llm.ToolSpec;
import com.wayfinder.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every call of one worker on a dedicated single-thread lane, so calls for a
 * session queue instead of overlapping, and bounds each call with a timeout.
 */
public class LaneBoundWorkerConnection implements WorkerConnection {

    private static final Logger log = LoggerFactory.getLogger(LaneBoundWorkerConnection.class);

    private final WorkerConnection delegate;
    private final WorkerProperties props;
    private final ExecutorService lane;

    public LaneBoundWorkerConnection(WorkerConnection delegate, WorkerProperties props) {
        this.delegate = delegate;
        this.props = props;
        String sessionId = delegate.sessionId();
        this.lane = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "worker-lane-" + shortId(sessionId));
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String sessionId() {
        return delegate.sessionId();
    }

    @Override
    public Map<String, Object> initialize(boolean headless, String url) {
        return onLane(TOOL_INITIALIZE, props.getInitTimeout(), () -> delegate.initialize(headless, url));
    }

    @Override
    public Map<String, Object> callTool(String name, Map<String, Object> arguments) {
        return callTool(name, arguments, props.getCallTimeout());
    }

    public Map<String, Object> callTool(String name, Map<String, Object> arguments, Duration timeout) {
        return onLane(name, timeout, () -> delegate.callTool(name, arguments));
    }

    @Override
    public List<ToolSpec> listTools() {
        return onLane("list_tools", props.getCallTimeout(), delegate::listTools);
    }

    @Override
    public Map<String, Object> restart(boolean headless, String url) {
        return onLane(TOOL_RESTART, props.getInitTimeout(), () -> delegate.restart(headless, url));
    }

    @Override
    public boolean isInitialized() {
        return !lane.isShutdown() && delegate.isInitialized();
    }

    @Override
    public void close() {
        close(props.getCloseTimeout());
    }

    /**
     * Closes the worker on its lane and retires the lane.
     *
     * @return {@code false} if the close did not finish within {@code timeout}
     */
    public boolean close(Duration timeout) {
        if (lane.isShutdown()) {
            return true;
        }
        try {
            onLane(TOOL_CLOSE, timeout, () -> {
                delegate.close();
                return null;
            });
            return true;
        } catch (ToolExecutionException e) {
            if (e.getErrorCode() == ErrorCode.AGENT_TIMEOUT_ERROR) {
                log.warn("Worker close timed out after {} for session {}", timeout, sessionId());
                return false;
            }
            log.warn("Worker close failed for session {}: {}", sessionId(), e.getMessage());
            return true;
        } finally {
            lane.shutdownNow();
        }
    }

    /** Drops the lane without waiting for the worker; used when a close already timed out. */
    public void abandon() {
        lane.shutdownNow();
    }

    private <T> T onLane(String toolName, Duration timeout, Callable<T> work) {
        String sessionId = sessionId();
        Future<T> future;
        try {
            future = lane.submit(() -> {
                MdcContext.setTool(sessionId, toolName);
                try {
                    return work.call();
                } finally {
                    MdcContext.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new WorkerUnavailableException("Worker for session " + sessionId + " has been closed");
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException(ErrorCode.AGENT_TIMEOUT_ERROR, toolName,
                    "Tool '" + toolName + "' timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolExecutionException(toolName, "Interrupted while waiting for tool '" + toolName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ToolExecutionException(toolName, "Tool '" + toolName + "' failed: " + cause.getMessage(), cause);
        }
    }

    private static String shortId(String sessionId) {
        return sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
    }
}

/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.streamplan.streaming;

import java.net.InetAddress;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the streaming of one peer for one streaming plan.
 *
 * <h2>Session lifecycle</h2>
 *
 * A session is created by the {@link StreamCoordinator} (through a {@link Factory}) and wired to the
 * plan's {@link StreamResultFuture} with {@link #init(StreamResultFuture)} before {@link #start()}
 * is called. Transport implementations then report their milestones:
 *
 * <ol>
 *   <li>{@link #prepared(int, long, int, long)} once both sides agreed on what is exchanged,</li>
 *   <li>{@link #startStreaming()} and any number of {@link #progress} calls while files move,</li>
 *   <li>{@link #complete()} on success, or {@link #onError(Throwable)} / {@link #sessionFailed()}
 *       on failure. Only the first of these closes the session.</li>
 * </ol>
 *
 * The state only moves forward, see {@link State#canTransitionTo(State)}.
 * <p>
 * A session never holds a lock while it calls back into the {@link StreamResultFuture}: callbacks
 * may run while the future holds its own monitor and starts the next session.
 */
public abstract class StreamSession
{
    private static final Logger logger = LoggerFactory.getLogger(StreamSession.class);

    /**
     * State Transition:
     *
     * <pre>
     *  +------------------+-----------> FAILED
     *  |                  |               ^
     *  |                  |               |
     * INITIALIZED --> PREPARING --> PREPARED --> STREAMING --> COMPLETE
     * </pre>
     *
     * FAILED is reachable from every non final state.
     */
    public enum State
    {
        INITIALIZED(false),
        PREPARING(false),
        PREPARED(false),
        STREAMING(false),
        COMPLETE(true),
        FAILED(true);

        private final boolean finalState;

        State(boolean finalState)
        {
            this.finalState = finalState;
        }

        /**
         * @return true if current state is final, either COMPLETE or FAILED.
         */
        public boolean isFinalState()
        {
            return finalState;
        }

        /**
         * @return true if a session in this state may move to {@code next}; staying put is allowed
         */
        public boolean canTransitionTo(State next)
        {
            if (this == next)
                return true;
            if (finalState)
                return false;
            return next.ordinal() > ordinal();
        }
    }

    /**
     * Creates sessions of a concrete transport for a {@link StreamCoordinator}.
     */
    public interface Factory
    {
        StreamSession create(InetAddress peer, int sessionIndex, boolean isFollower);
    }

    public final InetAddress peer;
    private final int index;
    private final boolean isFollower;

    private volatile StreamResultFuture streamResult;
    private final AtomicReference<State> state = new AtomicReference<>(State.INITIALIZED);
    private volatile String failureReason;

    private volatile int totalFilesToReceive;
    private volatile long totalSizeToReceive;
    private volatile int totalFilesToSend;
    private volatile long totalSizeToSend;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected StreamSession(InetAddress peer, int index, boolean isFollower)
    {
        this.peer = peer;
        this.index = index;
        this.isFollower = isFollower;
    }

    /**
     * Bind this session to report status to specified {@link StreamResultFuture}.
     *
     * @param streamResult result to report to
     */
    public void init(StreamResultFuture streamResult)
    {
        this.streamResult = streamResult;
    }

    /**
     * Open the connection to {@link #peer} and begin the exchange. Must not block: the
     * coordinator may call it while the plan's {@link StreamResultFuture} holds its monitor.
     */
    public abstract void start();

    /**
     * Release transport resources once the session reached a final state.
     */
    protected abstract void closeInternal(boolean success);

    public UUID planId()
    {
        StreamResultFuture result = streamResult;
        return result == null ? null : result.planId;
    }

    public String description()
    {
        StreamResultFuture result = streamResult;
        return result == null ? null : result.description;
    }

    public int sessionIndex()
    {
        return index;
    }

    public boolean isFollower()
    {
        return isFollower;
    }

    /**
     * @return the address actually connected to, which may differ from {@link #peer}
     */
    public InetAddress connectedTo()
    {
        return peer;
    }

    /**
     * @return current state
     */
    public State state()
    {
        return state.get();
    }

    /**
     * Set current state to {@code newState}.
     *
     * @param newState new state to set
     * @throws IllegalStateException if the session would move backward or leave a final state
     */
    public void state(State newState)
    {
        if (!advance(newState))
            throw new IllegalStateException(String.format("[Stream #%s] Session with %s cannot move from %s to %s", planId(), peer, state(), newState));
    }

    /**
     * Move to {@code newState} unless the session was already closed.
     *
     * @return false if the session is in another final state
     * @throws IllegalStateException if the session would move backward
     */
    private boolean advance(State newState)
    {
        while (true)
        {
            State current = state.get();
            if (current.isFinalState() && current != newState)
                return false;
            if (!current.canTransitionTo(newState))
                throw new IllegalStateException(String.format("[Stream #%s] Session with %s cannot move from %s to %s", planId(), peer, current, newState));
            if (state.compareAndSet(current, newState))
            {
                if (logger.isDebugEnabled())
                    logger.debug("[Stream #{}] Changing session state from {} to {}", planId(), current, newState);
                return true;
            }
        }
    }

    public boolean isSuccess()
    {
        return state() == State.COMPLETE;
    }

    @Override
    public String toString()
    {
        return "StreamSession{planId=" + planId() + ", peer=" + peer + ", index=" + index + ", state=" + state() + '}';
    }

    /**
     * Mark the beginning of the prepare exchange with the peer.
     */
    public void preparing()
    {
        if (!advance(State.PREPARING))
            logger.debug("[Stream #{}] Session with {} closed before preparing", planId(), peer);
    }

    /**
     * Both sides agreed on what is exchanged: record the totals and report the prepared session.
     * A session closed in the meantime (error from another thread) is not reported as prepared.
     */
    public void prepared(int filesToReceive, long sizeToReceive, int filesToSend, long sizeToSend)
    {
        Preconditions.checkState(streamResult != null, "Session with %s prepared before init", peer);

        this.totalFilesToReceive = filesToReceive;
        this.totalSizeToReceive = sizeToReceive;
        this.totalFilesToSend = filesToSend;
        this.totalSizeToSend = sizeToSend;
        if (!advance(State.PREPARED))
        {
            logger.debug("[Stream #{}] Session with {} closed as {} before it was prepared", planId(), peer, state());
            return;
        }
        // the info is taken now: by the time the plan handles it the session may already be closed
        streamResult.handleSessionPrepared(this, sessionInfo(State.PREPARED, null));
    }

    public void startStreaming()
    {
        if (!advance(State.STREAMING))
            logger.debug("[Stream #{}] Session with {} closed before streaming", planId(), peer);
    }

    public void progress(String filename, ProgressInfo.Direction direction, long bytes, long delta, long total)
    {
        Preconditions.checkState(streamResult != null, "Session with %s reported progress before init", peer);

        if (delta < 0)
            logger.warn("[Stream #{}] Stream event for {} with {} reported a negative delta ({})", planId(), filename, peer, delta);
        ProgressInfo progress = new ProgressInfo(peer, index, filename, direction, bytes, delta, total);
        streamResult.handleProgress(progress);
    }

    /**
     * Every file was exchanged; close the session as {@link State#COMPLETE}.
     */
    public void complete()
    {
        closeSession(State.COMPLETE, null);
    }

    /**
     * Signal an error to this stream session and close it as {@link State#FAILED}.
     */
    public void onError(Throwable e)
    {
        State current = state();
        if (current.isFinalState())
        {
            logger.debug("[Stream #{}] Error after session with {} completed with state {}", planId(), peer, current, e);
            return;
        }

        logger.error("[Stream #{}] Streaming error occurred on session with peer {}", planId(), peer, e);
        closeSession(State.FAILED, "Failed because of an " + e.getClass().getCanonicalName() + " with state=" + current.name() + ": " + e.getMessage());
    }

    /**
     * Call back on the remote peer reporting that it failed this session.
     */
    public void sessionFailed()
    {
        logger.error("[Stream #{}] Remote peer {} failed stream session.", planId(), peer);
        closeSession(State.FAILED, "Remote peer " + peer + " failed stream session");
    }

    private void closeSession(State finalState, String failureReason)
    {
        if (!closed.compareAndSet(false, true))
        {
            logger.debug("[Stream #{}] Session with {} already closed", planId(), peer);
            return;
        }

        this.failureReason = failureReason;
        state(finalState);

        try
        {
            // closed before init?
            if (streamResult != null)
                streamResult.handleSessionComplete(this, sessionInfo(finalState, failureReason));
        }
        finally
        {
            closeInternal(finalState == State.COMPLETE);
        }
    }

    /**
     * @return Current snapshot of this session info.
     */
    public SessionInfo getSessionInfo()
    {
        return sessionInfo(state(), failureReason);
    }

    private SessionInfo sessionInfo(State state, String failureReason)
    {
        return new SessionInfo(peer, index, connectedTo(),
                               totalFilesToReceive, totalSizeToReceive,
                               totalFilesToSend, totalSizeToSend,
                               state, failureReason);
    }
}

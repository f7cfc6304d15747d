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
import java.util.Collection;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.AbstractFuture;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A future on the result ({@link StreamState}) of a streaming plan.
 *
 * In practice, this object also groups all the {@link StreamSession} for the streaming job
 * involved. One StreamSession will be created for every peer involved and said session will
 * handle every streaming (outgoing and incoming) to that peer for this job.
 * <p>
 * The future will return a result once every session is completed (successfully or not). If
 * any session ended up with an error, the future will throw a StreamException.
 * <p>
 * You can attach {@link StreamEventHandler} to this object to listen on {@link StreamEvent}s to
 * track progress of the streaming. Handlers only see the events fired after they were added;
 * events are not replayed to late handlers, although their completion callback still fires.
 */
public final class StreamResultFuture extends AbstractFuture<StreamState>
{
    private static final Logger logger = LoggerFactory.getLogger(StreamResultFuture.class);

    public static final long DEFAULT_SLOW_EVENTS_LOG_TIMEOUT_NANOS = TimeUnit.SECONDS.toNanos(10);

    public final UUID planId;
    public final String description;
    private final StreamCoordinator coordinator;
    private final Collection<StreamEventHandler> eventListeners = new ConcurrentLinkedQueue<>();
    private final long slowEventsLogTimeoutNanos;

    /**
     * Create new StreamResult of given {@code planId} and description.
     *
     * Use {@link StreamPlan#execute()} or {@link #createFollower} to get a registered instance.
     *
     * @param planId Stream plan ID
     * @param description Stream description
     * @param coordinator coordinator owning the sessions of the plan
     * @param slowEventsLogTimeoutNanos event fan-out taking longer than this is logged
     */
    public StreamResultFuture(UUID planId, String description, StreamCoordinator coordinator, long slowEventsLogTimeoutNanos)
    {
        this.planId = planId;
        this.description = description;
        this.coordinator = coordinator;
        this.slowEventsLogTimeoutNanos = slowEventsLogTimeoutNanos;

        // if there is no session to listen to, we immediately set result for returning
        if (!coordinator.isReceiving() && !coordinator.hasActiveSessions())
            set(getCurrentState());
    }

    @VisibleForTesting
    public StreamResultFuture(UUID planId, String description, StreamCoordinator coordinator)
    {
        this(planId, description, coordinator, DEFAULT_SLOW_EVENTS_LOG_TIMEOUT_NANOS);
    }

    public static StreamResultFuture createInitiator(UUID planId,
                                                     String description,
                                                     Collection<StreamEventHandler> listeners,
                                                     StreamCoordinator coordinator,
                                                     StreamManager manager)
    {
        StreamResultFuture future = createAndRegisterInitiator(planId, description, coordinator, manager);
        if (listeners != null)
        {
            for (StreamEventHandler listener : listeners)
                future.addEventListener(listener);
        }

        logger.info("[Stream #{}] Executing streaming plan for {}", planId, description);

        // Initialize and start all sessions; every session is wired before the first one connects,
        // otherwise an early completion could resolve the plan before the later sessions exist
        for (final StreamSession session : coordinator.getAllStreamSessions())
        {
            session.init(future);
        }

        coordinator.connect(future);

        return future;
    }

    /**
     * Find or create the receiving side future of {@code planId} and attach the inbound session
     * {@code sessionIndex} from {@code from} to it.
     */
    public static StreamResultFuture createFollower(int sessionIndex,
                                                    UUID planId,
                                                    String description,
                                                    InetAddress from,
                                                    StreamSession.Factory sessionFactory,
                                                    StreamManager manager)
    {
        StreamResultFuture future = manager.getReceivingStream(planId);
        if (future == null)
        {
            logger.info("[Stream #{} ID#{}] Creating new streaming plan for {} from {}", planId, sessionIndex, description, from);

            StreamCoordinator coordinator = new StreamCoordinator(0, sessionFactory, true, false);
            future = new StreamResultFuture(planId, description, coordinator, manager.getDescriptor().getStreamingSlowEventsLogTimeoutNanos());
            // another inbound session of the same plan may have registered first
            future = manager.registerFollower(future);
        }
        future.initInbound(from, sessionIndex);
        logger.info("[Stream #{}, ID#{}] Received streaming plan for {} from {}", planId, sessionIndex, description, from);
        return future;
    }

    private static StreamResultFuture createAndRegisterInitiator(UUID planId, String description, StreamCoordinator coordinator, StreamManager manager)
    {
        StreamResultFuture future = new StreamResultFuture(planId, description, coordinator, manager.getDescriptor().getStreamingSlowEventsLogTimeoutNanos());
        manager.registerInitiator(future);
        return future;
    }

    public StreamCoordinator getCoordinator()
    {
        return coordinator;
    }

    private void initInbound(InetAddress from, int sessionIndex)
    {
        StreamSession session = coordinator.getOrCreateInboundSession(from, sessionIndex);
        session.init(this);
    }

    public void addEventListener(StreamEventHandler listener)
    {
        addCallback(listener);
        eventListeners.add(listener);
    }

    /**
     * Register {@code callback} to be notified, on the completing thread, once this plan resolves.
     */
    public void addCallback(FutureCallback<? super StreamState> callback)
    {
        Futures.addCallback(this, callback, MoreExecutors.directExecutor());
    }

    /**
     * @return Current snapshot of streaming progress.
     */
    public StreamState getCurrentState()
    {
        return new StreamState(planId, description, coordinator.getAllSessionInfo());
    }

    /**
     * Poll the outcome of this plan without blocking.
     *
     * @return null while sessions are still running, the final state once every session completed
     * @throws StreamException if the plan resolved and at least one session failed
     */
    @Nullable
    public StreamState tryResult() throws StreamException
    {
        if (!isDone())
            return null;

        try
        {
            return Futures.getDone(this);
        }
        catch (ExecutionException e)
        {
            Throwables.throwIfInstanceOf(e.getCause(), StreamException.class);
            throw new IllegalStateException("Unexpected failure of stream plan " + planId, e.getCause());
        }
    }

    /**
     * A streaming plan only resolves through its sessions; it cannot be cancelled through its future.
     *
     * @return false, always
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning)
    {
        return false;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamResultFuture that = (StreamResultFuture) o;
        return planId.equals(that.planId);
    }

    @Override
    public int hashCode()
    {
        return planId.hashCode();
    }

    /**
     * @param sessionInfo the info of {@code session} taken when it was prepared
     */
    synchronized void handleSessionPrepared(StreamSession session, SessionInfo sessionInfo)
    {
        // the session may have been closed by another thread while this call waited for the monitor
        if (coordinator.getSessionInfo(session.peer, session.sessionIndex()).isFinalState())
        {
            logger.debug("[Stream #{} ID#{}] Ignoring prepare of session with {}, already closed", planId, session.sessionIndex(), session.peer);
            return;
        }

        logger.info("[Stream #{} ID#{}] Prepare completed. Receiving {} files({} bytes), sending {} files({} bytes)",
                    planId,
                    session.sessionIndex(),
                    sessionInfo.getTotalFilesToReceive(),
                    sessionInfo.getTotalSizeToReceive(),
                    sessionInfo.getTotalFilesToSend(),
                    sessionInfo.getTotalSizeToSend());
        coordinator.addSessionInfo(sessionInfo);
        fireStreamEvent(new StreamEvent.SessionPreparedEvent(planId, sessionInfo));
    }

    synchronized void handleSessionComplete(StreamSession session, SessionInfo finalInfo)
    {
        logger.info("[Stream #{}] Session with {} is {}", planId, session.peer, finalInfo.state.name().toLowerCase());
        coordinator.addSessionInfo(finalInfo);
        // the recorded info carries the progress accumulated while streaming
        SessionInfo sessionInfo = coordinator.getSessionInfo(session.peer, session.sessionIndex());
        fireStreamEvent(new StreamEvent.SessionCompleteEvent(planId, sessionInfo));
        maybeComplete();
    }

    public synchronized void handleProgress(ProgressInfo progress)
    {
        // progress of a closed session is not part of the frozen snapshot, listeners don't see it either
        if (coordinator.updateProgress(progress))
            fireStreamEvent(new StreamEvent.ProgressEvent(planId, progress));
    }

    synchronized void fireStreamEvent(StreamEvent event)
    {
        // delegate to listener
        long startNanos = System.nanoTime();
        for (StreamEventHandler listener : eventListeners)
        {
            try
            {
                listener.handleStreamEvent(event);
            }
            catch (Throwable t)
            {
                logger.warn("[Stream #{}] Unexpected exception in listener while handling {}", planId, event, t);
            }
        }
        long totalNanos = System.nanoTime() - startNanos;
        if (totalNanos > slowEventsLogTimeoutNanos)
            logger.warn("[Stream #{}] Handling streaming event {} took longer than {}ms; took {}ms",
                        planId, event.eventType, TimeUnit.NANOSECONDS.toMillis(slowEventsLogTimeoutNanos), TimeUnit.NANOSECONDS.toMillis(totalNanos));
    }

    @VisibleForTesting
    synchronized void maybeComplete()
    {
        if (isDone() || coordinator.hasActiveSessions())
            return;

        StreamState finalState = getCurrentState();
        if (finalState.hasFailedSession())
        {
            StringBuilder stringBuilder = new StringBuilder();
            stringBuilder.append("Stream #").append(planId).append(" failed:");
            for (SessionInfo info : finalState.sessions())
            {
                if (info.isFailed())
                    stringBuilder.append("\nSession peer ").append(info.peer).append(" ID#").append(info.sessionIndex).append(' ').append(info.failureReason);
            }
            String message = stringBuilder.toString();
            logger.warn("[Stream #{}] {}", planId, message);
            setException(new StreamException(finalState, message));
        }
        else
        {
            logger.info("[Stream #{}] All sessions completed", planId);
            set(finalState);
        }
    }

    public StreamSession getSession(InetAddress peer, int sessionIndex)
    {
        return coordinator.getSessionById(peer, sessionIndex);
    }
}

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
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import com.google.common.base.Throwables;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statistics of one streaming plan: status, timings, and how many files and bytes moved.
 * <p>
 * Counts are derived from the {@link SessionInfo} of every session, as reported by the plan's
 * events: progress is folded per file the same way the plan folds it, and the record carried by
 * the completion event replaces the session's record, so a file is counted once whatever the
 * number of reports. Registered by {@link StreamManager} while stats are enabled, and kept by the
 * manager for a while after the plan finished.
 */
public class StreamingState implements StreamEventHandler
{
    private static final Logger logger = LoggerFactory.getLogger(StreamingState.class);

    public enum Status
    {INIT, START, SUCCESS, FAILURE}

    private final UUID id;
    private final boolean follower;
    private final String description;

    @GuardedBy("this")
    private final Table<InetAddress, Integer, SessionInfo> sessionInfos = HashBasedTable.create();
    @GuardedBy("this")
    private final EnumMap<Status, Long> stateTimesMillis = new EnumMap<>(Status.class);
    @GuardedBy("this")
    private Status status;
    @GuardedBy("this")
    private String failureCause;

    public StreamingState(StreamResultFuture result)
    {
        this.id = result.planId;
        this.description = result.description;
        this.follower = result.getCoordinator().isReceiving();
        updateState(Status.INIT);
    }

    public UUID id()
    {
        return id;
    }

    public boolean follower()
    {
        return follower;
    }

    public String description()
    {
        return description;
    }

    public synchronized Set<InetAddress> peers()
    {
        return ImmutableSet.copyOf(sessionInfos.rowKeySet());
    }

    public synchronized Status status()
    {
        return status;
    }

    public synchronized boolean isComplete()
    {
        return status == Status.SUCCESS || status == Status.FAILURE;
    }

    public synchronized Sessions sessions()
    {
        return Sessions.of(sessionInfos.values());
    }

    /**
     * @return fraction of the prepared bytes already transferred; never 1 before the plan resolved
     */
    public synchronized float progress()
    {
        switch (status)
        {
            case INIT:
                return 0;
            case START:
                return Math.min(0.99f, sessions().progress());
            case SUCCESS:
            case FAILURE:
                return 1;
            default:
                throw new AssertionError("unknown state: " + status);
        }
    }

    public synchronized Map<Status, Long> stateTimesMillis()
    {
        return new EnumMap<>(stateTimesMillis);
    }

    public synchronized long durationMillis()
    {
        long end = isComplete() ? stateTimesMillis.get(status) : System.currentTimeMillis();
        return end - stateTimesMillis.get(Status.INIT);
    }

    @Nullable
    public synchronized String failureCause()
    {
        return failureCause;
    }

    public synchronized void start()
    {
        updateState(Status.START);
    }

    @Override
    public synchronized void handleStreamEvent(StreamEvent event)
    {
        switch (event.eventType)
        {
            case STREAM_PREPARED:
                prepared(((StreamEvent.SessionPreparedEvent) event).session);
                break;
            case FILE_PROGRESS:
                progress(((StreamEvent.ProgressEvent) event).progress);
                break;
            case STREAM_COMPLETE:
                SessionInfo info = ((StreamEvent.SessionCompleteEvent) event).session;
                sessionInfos.put(info.peer, info.sessionIndex, info);
                break;
            default:
                logger.warn("Unknown stream event type: {}", event.eventType);
        }
    }

    private void prepared(SessionInfo info)
    {
        SessionInfo previous = sessionInfos.get(info.peer, info.sessionIndex);
        sessionInfos.put(info.peer, info.sessionIndex, previous == null ? info : info.withProgressOf(previous));
    }

    private void progress(ProgressInfo progress)
    {
        SessionInfo previous = sessionInfos.get(progress.peer, progress.sessionIndex);
        if (previous == null || previous.isFinalState())
        {
            logger.debug("[Stream #{}] No open session {}#{} for progress {}", id, progress.peer, progress.sessionIndex, progress);
            return;
        }
        sessionInfos.put(progress.peer, progress.sessionIndex, previous.withProgress(progress));
    }

    @Override
    public synchronized void onSuccess(@Nullable StreamState state)
    {
        updateState(Status.SUCCESS);
    }

    @Override
    public synchronized void onFailure(Throwable throwable)
    {
        failureCause = throwable instanceof StreamException
                       ? throwable.getMessage()
                       : Throwables.getStackTraceAsString(throwable);
        updateState(Status.FAILURE);
    }

    private synchronized void updateState(Status state)
    {
        status = state;
        stateTimesMillis.put(state, System.currentTimeMillis());
    }

    @Override
    public synchronized String toString()
    {
        StringBuilder sb = new StringBuilder("StreamingState{");
        sb.append("id=").append(id);
        sb.append(", status=").append(status.name().toLowerCase());
        sb.append(", progress=").append(progress() * 100).append('%');
        sb.append(", duration_ms=").append(durationMillis());
        sb.append(", ").append(sessions());
        sb.append('}');
        return sb.toString();
    }

    /**
     * Totals over every session of a plan.
     */
    public static final class Sessions
    {
        public final long bytesToReceive, bytesReceived;
        public final long bytesToSend, bytesSent;
        public final long filesToReceive, filesReceived;
        public final long filesToSend, filesSent;

        private Sessions(long bytesToReceive, long bytesReceived, long bytesToSend, long bytesSent,
                         long filesToReceive, long filesReceived, long filesToSend, long filesSent)
        {
            this.bytesToReceive = bytesToReceive;
            this.bytesReceived = bytesReceived;
            this.bytesToSend = bytesToSend;
            this.bytesSent = bytesSent;
            this.filesToReceive = filesToReceive;
            this.filesReceived = filesReceived;
            this.filesToSend = filesToSend;
            this.filesSent = filesSent;
        }

        static Sessions of(Iterable<SessionInfo> infos)
        {
            long bytesToReceive = 0, bytesReceived = 0, bytesToSend = 0, bytesSent = 0;
            long filesToReceive = 0, filesReceived = 0, filesToSend = 0, filesSent = 0;
            for (SessionInfo info : infos)
            {
                bytesToReceive += info.getTotalSizeToReceive();
                bytesReceived += info.getTotalSizeReceived();
                bytesToSend += info.getTotalSizeToSend();
                bytesSent += info.getTotalSizeSent();
                filesToReceive += info.getTotalFilesToReceive();
                filesReceived += info.getTotalFilesReceived();
                filesToSend += info.getTotalFilesToSend();
                filesSent += info.getTotalFilesSent();
            }
            return new Sessions(bytesToReceive, bytesReceived, bytesToSend, bytesSent,
                                filesToReceive, filesReceived, filesToSend, filesSent);
        }

        public float progress()
        {
            long total = bytesToReceive + bytesToSend;
            return total == 0 ? 0 : (float) (bytesReceived + bytesSent) / total;
        }

        @Override
        public String toString()
        {
            return String.format("received %d/%d files (%d/%d bytes), sent %d/%d files (%d/%d bytes)",
                                 filesReceived, filesToReceive, bytesReceived, bytesToReceive,
                                 filesSent, filesToSend, bytesSent, bytesToSend);
        }
    }
}

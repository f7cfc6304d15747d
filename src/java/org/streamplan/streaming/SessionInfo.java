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

import java.io.Serializable;
import java.net.InetAddress;
import java.util.Collection;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/**
 * Stream session info.
 * <p>
 * Instances are immutable: progress and state changes produce a new SessionInfo, so a
 * record handed out in a {@link StreamState} never changes after capture.
 */
public final class SessionInfo implements Serializable
{
    public final InetAddress peer;
    public final int sessionIndex;
    public final InetAddress connecting;
    public final int totalFilesToReceive;
    public final long totalSizeToReceive;
    public final int totalFilesToSend;
    public final long totalSizeToSend;
    /** Current session state */
    public final StreamSession.State state;
    @Nullable
    public final String failureReason;

    // keyed by file name
    private final ImmutableMap<String, ProgressInfo> receivingFiles;
    private final ImmutableMap<String, ProgressInfo> sendingFiles;

    public SessionInfo(InetAddress peer,
                       int sessionIndex,
                       InetAddress connecting,
                       int totalFilesToReceive,
                       long totalSizeToReceive,
                       int totalFilesToSend,
                       long totalSizeToSend,
                       StreamSession.State state,
                       @Nullable String failureReason)
    {
        this(peer, sessionIndex, connecting, totalFilesToReceive, totalSizeToReceive, totalFilesToSend, totalSizeToSend,
             state, failureReason, ImmutableMap.of(), ImmutableMap.of());
    }

    private SessionInfo(InetAddress peer,
                        int sessionIndex,
                        InetAddress connecting,
                        int totalFilesToReceive,
                        long totalSizeToReceive,
                        int totalFilesToSend,
                        long totalSizeToSend,
                        StreamSession.State state,
                        @Nullable String failureReason,
                        ImmutableMap<String, ProgressInfo> receivingFiles,
                        ImmutableMap<String, ProgressInfo> sendingFiles)
    {
        this.peer = peer;
        this.sessionIndex = sessionIndex;
        this.connecting = connecting;
        this.totalFilesToReceive = totalFilesToReceive;
        this.totalSizeToReceive = totalSizeToReceive;
        this.totalFilesToSend = totalFilesToSend;
        this.totalSizeToSend = totalSizeToSend;
        this.state = state;
        this.failureReason = failureReason;
        this.receivingFiles = receivingFiles;
        this.sendingFiles = sendingFiles;
    }

    public boolean isFailed()
    {
        return state == StreamSession.State.FAILED;
    }

    public boolean isFinalState()
    {
        return state.isFinalState();
    }

    /**
     * @return a copy of this info with {@code newProgress} folded into the progress of its file
     */
    public SessionInfo withProgress(ProgressInfo newProgress)
    {
        assert peer.equals(newProgress.peer) && sessionIndex == newProgress.sessionIndex;

        boolean receiving = newProgress.direction == ProgressInfo.Direction.IN;
        Map<String, ProgressInfo> currentFiles = receiving ? receivingFiles : sendingFiles;
        ProgressInfo previous = currentFiles.get(newProgress.fileName);
        ProgressInfo merged = previous == null || !previous.equals(newProgress) ? newProgress : previous.merge(newProgress);

        ImmutableMap<String, ProgressInfo> updated = ImmutableMap.<String, ProgressInfo>builder()
                                                                 .putAll(currentFiles)
                                                                 .put(newProgress.fileName, merged)
                                                                 .buildKeepingLast();
        return receiving
               ? new SessionInfo(peer, sessionIndex, connecting, totalFilesToReceive, totalSizeToReceive, totalFilesToSend, totalSizeToSend,
                                 state, failureReason, updated, sendingFiles)
               : new SessionInfo(peer, sessionIndex, connecting, totalFilesToReceive, totalSizeToReceive, totalFilesToSend, totalSizeToSend,
                                 state, failureReason, receivingFiles, updated);
    }

    /**
     * @return a copy of this info carrying the file progress accumulated in {@code accumulated}
     */
    SessionInfo withProgressOf(SessionInfo accumulated)
    {
        return new SessionInfo(peer, sessionIndex, connecting, totalFilesToReceive, totalSizeToReceive, totalFilesToSend, totalSizeToSend,
                               state, failureReason, accumulated.receivingFiles, accumulated.sendingFiles);
    }

    public Collection<ProgressInfo> getReceivingFiles()
    {
        return receivingFiles.values();
    }

    public Collection<ProgressInfo> getSendingFiles()
    {
        return sendingFiles.values();
    }

    /**
     * @return total number of files already received.
     */
    public long getTotalFilesReceived()
    {
        return getTotalFilesCompleted(receivingFiles.values());
    }

    /**
     * @return total number of files already sent.
     */
    public long getTotalFilesSent()
    {
        return getTotalFilesCompleted(sendingFiles.values());
    }

    /**
     * @return total size(in bytes) already received.
     */
    public long getTotalSizeReceived()
    {
        return getTotalSizeInProgress(receivingFiles.values());
    }

    /**
     * @return total size(in bytes) already sent.
     */
    public long getTotalSizeSent()
    {
        return getTotalSizeInProgress(sendingFiles.values());
    }

    public long getTotalSizeTransferred()
    {
        return getTotalSizeReceived() + getTotalSizeSent();
    }

    public int getTotalFilesToReceive()
    {
        return totalFilesToReceive;
    }

    public long getTotalSizeToReceive()
    {
        return totalSizeToReceive;
    }

    public int getTotalFilesToSend()
    {
        return totalFilesToSend;
    }

    public long getTotalSizeToSend()
    {
        return totalSizeToSend;
    }

    private long getTotalSizeInProgress(Collection<ProgressInfo> streams)
    {
        long total = 0;
        for (ProgressInfo stream : streams)
            total += stream.currentBytes;
        return total;
    }

    private long getTotalFilesCompleted(Collection<ProgressInfo> files)
    {
        Iterable<ProgressInfo> completed = Iterables.filter(files, new Predicate<ProgressInfo>()
        {
            public boolean apply(ProgressInfo input)
            {
                return input.isCompleted();
            }
        });
        return Iterables.size(completed);
    }

    @Override
    public String toString()
    {
        return "SessionInfo{" +
               "peer=" + peer +
               ", sessionIndex=" + sessionIndex +
               ", state=" + state +
               ", receiving=" + getTotalSizeReceived() + '/' + totalSizeToReceive +
               ", sending=" + getTotalSizeSent() + '/' + totalSizeToSend +
               (failureReason == null ? "" : ", failureReason='" + failureReason + '\'') +
               '}';
    }
}

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
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The latest {@link SessionInfo} of every session of a plan, keyed by peer and session index.
 * <p>
 * Records are only added or replaced, never removed, and a record's state never moves backward.
 * A progress or completion report for a session that was never prepared is a broken contract
 * between the session and its plan; it is rejected with an {@link IllegalStateException} and
 * leaves the table untouched.
 */
public class SessionInfoTable
{
    private static final Logger logger = LoggerFactory.getLogger(SessionInfoTable.class);

    @GuardedBy("this")
    private final Table<InetAddress, Integer, SessionInfo> sessionInfos = Tables.newCustomTable(new LinkedHashMap<InetAddress, Map<Integer, SessionInfo>>(),
                                                                                                 LinkedHashMap::new);

    /**
     * Record a newly created session. A session registered twice keeps its first record.
     */
    public synchronized void register(SessionInfo info)
    {
        if (!sessionInfos.contains(info.peer, info.sessionIndex))
            sessionInfos.put(info.peer, info.sessionIndex, info);
    }

    /**
     * Replace the whole record of a prepared session.
     */
    public synchronized void prepared(SessionInfo info)
    {
        Preconditions.checkArgument(!info.isFinalState(), "Prepared session info cannot be in final state %s", info.state);

        SessionInfo previous = sessionInfos.get(info.peer, info.sessionIndex);
        if (previous != null && !previous.state.canTransitionTo(info.state))
            throw new IllegalStateException(String.format("Session %s#%d cannot move from %s to %s",
                                                          info.peer, info.sessionIndex, previous.state, info.state));
        sessionInfos.put(info.peer, info.sessionIndex, info);
    }

    /**
     * Merge progress into the record of an already prepared session.
     *
     * @return false if the session is already final and the progress was dropped
     */
    public synchronized boolean updateProgress(ProgressInfo progress)
    {
        SessionInfo previous = sessionInfos.get(progress.peer, progress.sessionIndex);
        if (previous == null)
            throw new IllegalStateException(String.format("Progress reported for unknown session %s#%d: %s",
                                                          progress.peer, progress.sessionIndex, progress));

        if (previous.isFinalState())
        {
            logger.warn("Ignoring progress for session {}#{} already in final state {}: {}",
                        progress.peer, progress.sessionIndex, previous.state, progress);
            return false;
        }

        if (!wasPrepared(previous))
            throw new IllegalStateException(String.format("Progress reported for session %s#%d that was never prepared (state %s): %s",
                                                          progress.peer, progress.sessionIndex, previous.state, progress));

        sessionInfos.put(progress.peer, progress.sessionIndex, previous.withProgress(progress));
        return true;
    }

    /**
     * Record the final state of a session. File progress accumulated so far is kept and frozen.
     */
    public synchronized void completed(SessionInfo info)
    {
        Preconditions.checkArgument(info.isFinalState(), "Completed session info must be in final state, not %s", info.state);

        SessionInfo previous = sessionInfos.get(info.peer, info.sessionIndex);
        if (previous == null)
            throw new IllegalStateException(String.format("Completion reported for unknown session %s#%d", info.peer, info.sessionIndex));

        if (previous.isFinalState())
        {
            if (previous.state != info.state)
                throw new IllegalStateException(String.format("Session %s#%d already completed as %s, cannot complete as %s",
                                                              info.peer, info.sessionIndex, previous.state, info.state));
            logger.debug("Session {}#{} already recorded as {}", info.peer, info.sessionIndex, info.state);
            return;
        }

        // a session may fail before it is prepared (connection refused, peer down), but it cannot succeed
        if (info.state == StreamSession.State.COMPLETE && !wasPrepared(previous))
            throw new IllegalStateException(String.format("Session %s#%d completed but was never prepared (state %s)",
                                                          info.peer, info.sessionIndex, previous.state));

        sessionInfos.put(info.peer, info.sessionIndex, info.withProgressOf(previous));
    }

    @Nullable
    public synchronized SessionInfo get(InetAddress peer, int sessionIndex)
    {
        return sessionInfos.get(peer, sessionIndex);
    }

    /**
     * @return true if any recorded session is not in a final state
     */
    public synchronized boolean hasActiveSessions()
    {
        for (SessionInfo info : sessionInfos.values())
        {
            if (!info.isFinalState())
                return true;
        }
        return false;
    }

    /**
     * @return an immutable copy of every record, in registration order
     */
    public synchronized ImmutableSet<SessionInfo> snapshot()
    {
        return ImmutableSet.copyOf(sessionInfos.values());
    }

    public synchronized int size()
    {
        return sessionInfos.size();
    }

    private static boolean wasPrepared(SessionInfo info)
    {
        return info.state.compareTo(StreamSession.State.PREPARED) >= 0;
    }
}

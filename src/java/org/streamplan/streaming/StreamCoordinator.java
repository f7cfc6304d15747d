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
import java.util.*;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StreamCoordinator} is a helper class that abstracts away maintaining multiple
 * StreamSession and ProgressInfo instances per peer.
 *
 * This class coordinates multiple SessionStreams per peer in both the outgoing StreamPlan context and on the
 * inbound StreamResultFuture context.
 */
public class StreamCoordinator
{
    private static final Logger logger = LoggerFactory.getLogger(StreamCoordinator.class);

    private final boolean connectSequentially;

    private final Map<InetAddress, HostStreamingData> peerSessions = new LinkedHashMap<>();
    private final SessionInfoTable sessionInfos = new SessionInfoTable();
    private final int connectionsPerHost;
    private final boolean follower;
    private final StreamSession.Factory factory;
    private Iterator<StreamSession> sessionsToConnect = null;

    public StreamCoordinator(int connectionsPerHost, StreamSession.Factory factory, boolean follower, boolean connectSequentially)
    {
        this.connectionsPerHost = connectionsPerHost;
        this.factory = factory;
        this.follower = follower;
        this.connectSequentially = connectSequentially;
    }

    /**
     * @return true if any stream session is active
     */
    public synchronized boolean hasActiveSessions()
    {
        // decided on the recorded session infos rather than the live session states: a session that already
        // switched to a final state but whose final info is not recorded yet still counts as active
        return sessionInfos.hasActiveSessions();
    }

    public synchronized Collection<StreamSession> getAllStreamSessions()
    {
        Collection<StreamSession> results = new ArrayList<>();
        for (HostStreamingData data : peerSessions.values())
        {
            results.addAll(data.getAllStreamSessions());
        }
        return results;
    }

    /**
     * @return true on the receiving side of a plan, where sessions are attached as peers connect
     */
    public boolean isReceiving()
    {
        return follower;
    }

    public void connect(StreamResultFuture future)
    {
        if (this.connectSequentially)
            connectSequentially(future);
        else
            connectAllStreamSessions();
    }

    private void connectAllStreamSessions()
    {
        for (StreamSession session : getAllStreamSessions())
            startSession(session);
    }

    private void connectSequentially(StreamResultFuture future)
    {
        sessionsToConnect = getAllStreamSessions().iterator();
        future.addEventListener(new StreamEventHandler()
        {
            public void handleStreamEvent(StreamEvent event)
            {
                if (event.eventType == StreamEvent.Type.STREAM_PREPARED || event.eventType == StreamEvent.Type.STREAM_COMPLETE)
                    connectNext();
            }

            public void onSuccess(StreamState result)
            {

            }

            public void onFailure(Throwable t)
            {

            }
        });
        connectNext();
    }

    private void connectNext()
    {
        StreamSession next;
        // sessions are started outside of the coordinator monitor, a session may report back synchronously
        synchronized (this)
        {
            if (sessionsToConnect == null)
                return;

            if (!sessionsToConnect.hasNext())
            {
                logger.debug("Finished connecting all sessions");
                sessionsToConnect = null;
                return;
            }
            next = sessionsToConnect.next();
        }

        if (logger.isDebugEnabled())
            logger.debug("Connecting next session {} with {}.", next.planId(), next.peer);
        startSession(next);
    }

    public synchronized Set<InetAddress> getPeers()
    {
        return new LinkedHashSet<>(peerSessions.keySet());
    }

    public synchronized StreamSession getOrCreateOutboundSession(InetAddress peer)
    {
        return getOrCreateHostData(peer).getOrCreateOutboundSession(peer);
    }

    public synchronized StreamSession getOrCreateInboundSession(InetAddress from, int id)
    {
        return getOrCreateHostData(from).getOrCreateInboundSession(from, id);
    }

    public synchronized StreamSession getSessionById(InetAddress peer, int id)
    {
        HostStreamingData data = peerSessions.get(peer);
        return data == null ? null : data.getSessionById(id);
    }

    /**
     * @return false if the session already reached a final state and the progress was dropped
     */
    public synchronized boolean updateProgress(ProgressInfo info)
    {
        return sessionInfos.updateProgress(info);
    }

    /**
     * Record the info reported by a session: the prepared record replaces the previous one,
     * a final record completes the session.
     */
    public synchronized void addSessionInfo(SessionInfo session)
    {
        if (session.isFinalState())
            sessionInfos.completed(session);
        else
            sessionInfos.prepared(session);
    }

    public synchronized ImmutableSet<SessionInfo> getAllSessionInfo()
    {
        return sessionInfos.snapshot();
    }

    public synchronized SessionInfo getSessionInfo(InetAddress peer, int sessionIndex)
    {
        SessionInfo info = sessionInfos.get(peer, sessionIndex);
        if (info == null)
            throw new IllegalArgumentException("Unknown session requested: " + peer + " ID#" + sessionIndex);
        return info;
    }

    private HostStreamingData getOrCreateHostData(InetAddress peer)
    {
        HostStreamingData data = peerSessions.get(peer);
        if (data == null)
        {
            data = new HostStreamingData();
            peerSessions.put(peer, data);
        }
        return data;
    }

    private void startSession(StreamSession session)
    {
        session.start();
        logger.info("[Stream #{}, ID#{}] Beginning stream session with {}", session.planId(), session.sessionIndex(), session.peer);
    }

    @VisibleForTesting
    int connectionsPerHost()
    {
        return connectionsPerHost;
    }

    private class HostStreamingData
    {
        private final Map<Integer, StreamSession> streamSessions = new LinkedHashMap<>();

        private int lastReturned = -1;

        public StreamSession getOrCreateOutboundSession(InetAddress peer)
        {
            // create
            if (streamSessions.size() < connectionsPerHost)
            {
                StreamSession session = factory.create(peer, streamSessions.size(), follower);
                streamSessions.put(++lastReturned, session);
                sessionInfos.register(session.getSessionInfo());
                return session;
            }
            // get
            else
            {
                lastReturned = (lastReturned + 1) % streamSessions.size();
                return streamSessions.get(lastReturned);
            }
        }

        public Collection<StreamSession> getAllStreamSessions()
        {
            return Collections.unmodifiableCollection(streamSessions.values());
        }

        public StreamSession getOrCreateInboundSession(InetAddress from, int id)
        {
            StreamSession session = streamSessions.get(id);
            if (session == null)
            {
                session = factory.create(from, id, follower);
                streamSessions.put(id, session);
                sessionInfos.register(session.getSessionInfo());
            }
            return session;
        }

        public StreamSession getSessionById(int id)
        {
            return streamSessions.get(id);
        }
    }
}

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

/**
 * {@link StreamPlan} is a helper class that builds a streaming plan: the sessions to every peer
 * involved and the handlers listening on the plan.
 *
 * @see StreamPlan#session(InetAddress)
 * @see StreamPlan#execute()
 */
public class StreamPlan
{
    private final UUID planId = UUID.randomUUID();
    private final String description;
    private final List<StreamEventHandler> handlers = new ArrayList<>();
    private final StreamCoordinator coordinator;
    private final StreamManager manager;

    /**
     * Start building stream plan.
     *
     * @param manager registry the executed plan registers with
     * @param description human readable purpose of this StreamPlan
     * @param factory creates the transport specific session of every peer
     */
    public StreamPlan(StreamManager manager, String description, StreamSession.Factory factory)
    {
        this(manager, description, factory, manager.getDescriptor().getStreamingConnectionsPerHost(), false);
    }

    public StreamPlan(StreamManager manager, String description, StreamSession.Factory factory, boolean connectSequentially)
    {
        this(manager, description, factory, manager.getDescriptor().getStreamingConnectionsPerHost(), connectSequentially);
    }

    public StreamPlan(StreamManager manager, String description, StreamSession.Factory factory,
                      int connectionsPerHost, boolean connectSequentially)
    {
        this.manager = manager;
        this.description = description;
        this.coordinator = new StreamCoordinator(connectionsPerHost, factory, false, connectSequentially);
    }

    /**
     * Get the session that streams with {@code peer}, creating it if needed. With more than one
     * connection per host, successive calls create sessions up to the limit and then hand them
     * out round robin; the caller gives each returned session its share of the work.
     *
     * @param peer endpoint address to stream with
     * @return session to {@code peer}
     */
    public StreamSession session(InetAddress peer)
    {
        return coordinator.getOrCreateOutboundSession(peer);
    }

    public StreamPlan listeners(StreamEventHandler handler, StreamEventHandler... handlers)
    {
        this.handlers.add(handler);
        if (handlers != null)
            Collections.addAll(this.handlers, handlers);
        return this;
    }

    public UUID planId()
    {
        return planId;
    }

    public String description()
    {
        return description;
    }

    @VisibleForTesting
    public List<StreamEventHandler> handlers()
    {
        return handlers;
    }

    /**
     * @return true if this plan has no plan to execute
     */
    public boolean isEmpty()
    {
        return !coordinator.hasActiveSessions();
    }

    /**
     * Execute this {@link StreamPlan} asynchronously.
     *
     * @return Future {@link StreamState} that you can use to listen on progress of streaming.
     */
    public StreamResultFuture execute()
    {
        return StreamResultFuture.createInitiator(planId, description, handlers, coordinator, manager);
    }

    @VisibleForTesting
    public StreamCoordinator getCoordinator()
    {
        return coordinator;
    }
}

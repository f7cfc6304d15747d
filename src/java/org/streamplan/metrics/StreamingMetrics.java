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
package org.streamplan.metrics;

import java.net.InetAddress;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import org.cliffc.high_scale_lib.NonBlockingHashMap;

import org.streamplan.streaming.ProgressInfo;
import org.streamplan.streaming.StreamEvent;
import org.streamplan.streaming.StreamEventHandler;
import org.streamplan.streaming.StreamState;

/**
 * Metrics for streaming plans, registered in a {@link MetricRegistry} owned by the stream manager.
 */
public class StreamingMetrics
{
    public static final String TYPE_NAME = "Streaming";

    private final MetricRegistry registry;
    private final ConcurrentMap<InetAddress, PeerMetrics> peers = new NonBlockingHashMap<>();

    public final Counter activeInitiatorStreams;
    public final Counter activeFollowerStreams;
    public final Meter successfulStreams;
    public final Meter failedStreams;
    public final Counter totalIncomingBytes;
    public final Counter totalOutgoingBytes;

    public StreamingMetrics()
    {
        this(new MetricRegistry());
    }

    public StreamingMetrics(MetricRegistry registry)
    {
        this.registry = registry;
        activeInitiatorStreams = registry.counter(MetricRegistry.name(TYPE_NAME, "ActiveInitiatorStreams"));
        activeFollowerStreams = registry.counter(MetricRegistry.name(TYPE_NAME, "ActiveFollowerStreams"));
        successfulStreams = registry.meter(MetricRegistry.name(TYPE_NAME, "SuccessfulStreams"));
        failedStreams = registry.meter(MetricRegistry.name(TYPE_NAME, "FailedStreams"));
        totalIncomingBytes = registry.counter(MetricRegistry.name(TYPE_NAME, "TotalIncomingBytes"));
        totalOutgoingBytes = registry.counter(MetricRegistry.name(TYPE_NAME, "TotalOutgoingBytes"));
    }

    public MetricRegistry registry()
    {
        return registry;
    }

    public PeerMetrics get(InetAddress peer)
    {
        return peers.computeIfAbsent(peer, PeerMetrics::new);
    }

    /**
     * Count a newly registered plan as active and return the handler that keeps the metrics of
     * that plan up to date until it resolves.
     */
    public StreamEventHandler handler(boolean follower)
    {
        Counter active = follower ? activeFollowerStreams : activeInitiatorStreams;
        active.inc();
        return new PlanMetricsHandler(active);
    }

    public class PeerMetrics
    {
        public final Counter incomingBytes;
        public final Counter outgoingBytes;

        private PeerMetrics(InetAddress peer)
        {
            String scope = peer.getHostAddress().replace(':', '.');
            incomingBytes = registry.counter(MetricRegistry.name(TYPE_NAME, scope, "IncomingBytes"));
            outgoingBytes = registry.counter(MetricRegistry.name(TYPE_NAME, scope, "OutgoingBytes"));
        }
    }

    private class PlanMetricsHandler implements StreamEventHandler
    {
        private final Counter active;

        private PlanMetricsHandler(Counter active)
        {
            this.active = active;
        }

        public void handleStreamEvent(StreamEvent event)
        {
            if (event.eventType != StreamEvent.Type.FILE_PROGRESS)
                return;

            ProgressInfo progress = ((StreamEvent.ProgressEvent) event).progress;
            if (progress.deltaBytes <= 0)
                return;

            PeerMetrics peerMetrics = get(progress.peer);
            if (progress.direction == ProgressInfo.Direction.IN)
            {
                totalIncomingBytes.inc(progress.deltaBytes);
                peerMetrics.incomingBytes.inc(progress.deltaBytes);
            }
            else
            {
                totalOutgoingBytes.inc(progress.deltaBytes);
                peerMetrics.outgoingBytes.inc(progress.deltaBytes);
            }
        }

        public void onSuccess(@Nullable StreamState result)
        {
            active.dec();
            successfulStreams.mark();
        }

        public void onFailure(Throwable t)
        {
            active.dec();
            failedStreams.mark();
        }
    }
}

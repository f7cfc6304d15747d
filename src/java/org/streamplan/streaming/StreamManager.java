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
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.MoreExecutors;
import org.cliffc.high_scale_lib.NonBlockingHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.streamplan.config.StreamingDescriptor;
import org.streamplan.metrics.StreamingMetrics;

/**
 * Registry of the streaming plans running in this process, looked up by plan id.
 * <p>
 * One instance is owned by the hosting streaming subsystem: create it with the subsystem,
 * {@link #start()} it, and {@link #stop()} it on shutdown. Plans register themselves through
 * {@link StreamResultFuture#createInitiator} and {@link StreamResultFuture#createFollower}
 * and are removed as soon as they resolve.
 */
public class StreamManager
{
    private static final Logger logger = LoggerFactory.getLogger(StreamManager.class);

    private final StreamingDescriptor descriptor;
    private final StreamingMetrics metrics;
    private final CopyOnWriteArrayList<StreamListener> listeners = new CopyOnWriteArrayList<>();

    /*
     * Currently running streams. Removed after completion/failure.
     * We manage them in two different maps to distinguish plan from initiated ones to
     * receiving ones withing the same JVM.
     */
    private final Map<UUID, StreamResultFuture> initiatorStreams = new NonBlockingHashMap<>();
    private final Map<UUID, StreamResultFuture> followerStreams = new NonBlockingHashMap<>();

    private final Cache<UUID, StreamingState> states;
    private final StreamListener listener = new StreamListener()
    {
        @Override
        public void onRegister(StreamResultFuture result)
        {
            if (!descriptor.getStreamingStatsEnabled())
                return;
            // reason for synchronized rather than states.get is to detect duplicates
            // streaming shouldn't be producing duplicates as that would imply a planId collision
            synchronized (states)
            {
                StreamingState previous = states.getIfPresent(result.planId);
                if (previous == null)
                {
                    StreamingState state = new StreamingState(result);
                    states.put(state.id(), state);
                    state.start();
                    result.addEventListener(state);
                }
                else
                {
                    logger.warn("Duplicate streaming states detected for id {}", result.planId);
                }
            }
        }
    };

    public StreamManager(StreamingDescriptor descriptor)
    {
        this(descriptor, new StreamingMetrics());
    }

    public StreamManager(StreamingDescriptor descriptor, StreamingMetrics metrics)
    {
        this.descriptor = descriptor;
        this.metrics = metrics;
        long expiresMillis = descriptor.getStreamingStateExpiresMillis();
        int maxEntries = descriptor.getStreamingStateMaxEntries();
        logger.info("Storing streaming state for {}ms or for {} plans", expiresMillis, maxEntries);
        states = CacheBuilder.newBuilder()
                             .expireAfterWrite(expiresMillis, TimeUnit.MILLISECONDS)
                             .maximumSize(maxEntries)
                             .build();
    }

    public void start()
    {
        addListener(listener);
    }

    /**
     * Stop tracking statistics of new plans and forget every plan still registered.
     */
    public void stop()
    {
        removeListener(listener);
        int running = initiatorStreams.size() + followerStreams.size();
        if (running > 0)
            logger.warn("Stopping stream manager with {} streaming plans still running", running);
        initiatorStreams.clear();
        followerStreams.clear();
    }

    public StreamingDescriptor getDescriptor()
    {
        return descriptor;
    }

    public StreamingMetrics metrics()
    {
        return metrics;
    }

    public Collection<StreamingState> getStreamingStates()
    {
        return states.asMap().values();
    }

    public StreamingState getStreamingState(UUID id)
    {
        return states.getIfPresent(id);
    }

    @VisibleForTesting
    public void clearStates()
    {
        states.invalidateAll();
    }

    /**
     * @return current snapshot of every plan still running, on either side
     */
    public Set<StreamState> getCurrentStreams()
    {
        return Sets.newHashSet(Iterables.transform(Iterables.concat(initiatorStreams.values(), followerStreams.values()),
                                                   StreamResultFuture::getCurrentState));
    }

    public void registerInitiator(final StreamResultFuture result)
    {
        result.addEventListener(metrics.handler(false));

        initiatorStreams.put(result.planId, result);
        // Make sure we remove the stream on completion (whether successful or not); registered after
        // the put so that an already resolved plan is removed right away
        result.addListener(() -> initiatorStreams.remove(result.planId), MoreExecutors.directExecutor());
        notifySafeOnRegister(result);
    }

    /**
     * @return {@code result}, or the future already registered for the same plan id
     */
    public StreamResultFuture registerFollower(final StreamResultFuture result)
    {
        StreamResultFuture previous = followerStreams.putIfAbsent(result.planId, result);
        if (previous != null)
            return previous;

        result.addEventListener(metrics.handler(true));
        result.addListener(() -> followerStreams.remove(result.planId), MoreExecutors.directExecutor());
        notifySafeOnRegister(result);
        return result;
    }

    public void addListener(StreamListener listener)
    {
        listeners.add(listener);
    }

    public void removeListener(StreamListener listener)
    {
        listeners.remove(listener);
    }

    private void notifySafeOnRegister(StreamResultFuture result)
    {
        for (StreamListener l : listeners)
        {
            try
            {
                l.onRegister(result);
            }
            catch (Throwable t)
            {
                logger.warn("Failed to notify stream listener of new Initiator/Follower", t);
            }
        }
    }

    public StreamResultFuture getReceivingStream(UUID planId)
    {
        return followerStreams.get(planId);
    }

    public StreamResultFuture getInitiatorStream(UUID planId)
    {
        return initiatorStreams.get(planId);
    }

    public StreamSession findSession(InetAddress peer, UUID planId, int sessionIndex, boolean searchInitiatorSessions)
    {
        Map<UUID, StreamResultFuture> streams = searchInitiatorSessions ? initiatorStreams : followerStreams;
        StreamResultFuture streamResultFuture = streams.get(planId);
        if (streamResultFuture == null)
            return null;

        return streamResultFuture.getSession(peer, sessionIndex);
    }

    public long getTotalRemainingOngoingBytes()
    {
        long total = 0;
        for (StreamResultFuture fut : Iterables.concat(initiatorStreams.values(), followerStreams.values()))
        {
            for (SessionInfo sessionInfo : fut.getCurrentState().sessions)
                total += sessionInfo.getTotalSizeToReceive() - sessionInfo.getTotalSizeReceived();
        }
        return total;
    }

    public interface StreamListener
    {
        default void onRegister(StreamResultFuture result) {}
    }
}

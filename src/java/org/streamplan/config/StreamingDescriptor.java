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
package org.streamplan.config;

import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.streamplan.exceptions.ConfigurationException;

/**
 * Validated, typed view over a {@link Config}.
 * <p>
 * One instance is created by the hosting process together with its
 * {@link org.streamplan.streaming.StreamManager} and handed to everything that needs settings.
 */
public class StreamingDescriptor
{
    private static final Logger logger = LoggerFactory.getLogger(StreamingDescriptor.class);

    private final Config conf;

    public StreamingDescriptor(Config conf) throws ConfigurationException
    {
        applyConfig(conf);
        this.conf = conf;
    }

    /**
     * Loads streaming.yaml (or the file named by -Dstreamplan.config) and validates it.
     */
    public static StreamingDescriptor load() throws ConfigurationException
    {
        return load(new YamlConfigurationLoader());
    }

    public static StreamingDescriptor load(ConfigurationLoader loader) throws ConfigurationException
    {
        return new StreamingDescriptor(loader.loadConfig());
    }

    @VisibleForTesting
    public static StreamingDescriptor defaults()
    {
        try
        {
            return new StreamingDescriptor(new Config());
        }
        catch (ConfigurationException e)
        {
            throw new AssertionError("default configuration must be valid", e);
        }
    }

    private static void applyConfig(Config conf) throws ConfigurationException
    {
        if (conf.streaming_connections_per_host <= 0)
            throw new ConfigurationException("streaming_connections_per_host must be positive, but was " + conf.streaming_connections_per_host);

        if (conf.streaming_slow_events_log_timeout_in_ms < 0)
            throw new ConfigurationException("streaming_slow_events_log_timeout_in_ms must not be negative, but was " + conf.streaming_slow_events_log_timeout_in_ms);

        if (conf.streaming_state_expires_in_ms <= 0)
            throw new ConfigurationException("streaming_state_expires_in_ms must be positive, but was " + conf.streaming_state_expires_in_ms);

        if (conf.streaming_state_max_entries < 0)
            throw new ConfigurationException("streaming_state_max_entries must not be negative, but was " + conf.streaming_state_max_entries);

        if (conf.streaming_stats_enabled && conf.streaming_state_max_entries == 0)
            logger.warn("streaming_stats_enabled is set but streaming_state_max_entries is 0; finished plans will not be retained");
    }

    public int getStreamingConnectionsPerHost()
    {
        return conf.streaming_connections_per_host;
    }

    public long getStreamingSlowEventsLogTimeoutNanos()
    {
        return TimeUnit.MILLISECONDS.toNanos(conf.streaming_slow_events_log_timeout_in_ms);
    }

    public boolean getStreamingStatsEnabled()
    {
        return conf.streaming_stats_enabled;
    }

    public void setStreamingStatsEnabled(boolean streamingStatsEnabled)
    {
        logger.info("Setting streaming_stats_enabled to {}", streamingStatsEnabled);
        conf.streaming_stats_enabled = streamingStatsEnabled;
    }

    public long getStreamingStateExpiresMillis()
    {
        return conf.streaming_state_expires_in_ms;
    }

    public int getStreamingStateMaxEntries()
    {
        return conf.streaming_state_max_entries;
    }
}

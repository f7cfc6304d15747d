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

/**
 * A class that contains configuration properties for the streaming subsystem.
 * <p>
 * Properties are bound by name from streaming.yaml, see {@link YamlConfigurationLoader}.
 * Validation and typed access go through {@link StreamingDescriptor}.
 */
public class Config
{
    public static final String PROPERTY_PREFIX = "streamplan.";

    public int streaming_connections_per_host = 1;

    public long streaming_slow_events_log_timeout_in_ms = 10000;

    public volatile boolean streaming_stats_enabled = true;

    public long streaming_state_expires_in_ms = TimeUnit.DAYS.toMillis(3);
    public int streaming_state_max_entries = 1000;
}

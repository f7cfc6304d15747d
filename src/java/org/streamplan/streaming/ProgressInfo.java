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

import com.google.common.base.Objects;

/**
 * ProgressInfo contains stream transfer progress of a single file within one session.
 */
public class ProgressInfo implements Serializable
{
    /**
     * Direction of the stream.
     */
    public static enum Direction
    {
        OUT,
        IN
    }

    public final InetAddress peer;
    public final int sessionIndex;
    public final String fileName;
    public final Direction direction;
    public final long currentBytes;
    public final long deltaBytes; // change from previous ProgressInfo
    public final long totalBytes;

    public ProgressInfo(InetAddress peer, int sessionIndex, String fileName, Direction direction,
                        long currentBytes, long deltaBytes, long totalBytes)
    {
        assert totalBytes >= 0 : totalBytes;

        this.peer = peer;
        this.sessionIndex = sessionIndex;
        this.fileName = fileName;
        this.direction = direction;
        this.currentBytes = currentBytes;
        this.deltaBytes = deltaBytes;
        this.totalBytes = totalBytes;
    }

    /**
     * Folds a newer report for the same file into this one: the byte count grows by the
     * newer report's delta.
     */
    ProgressInfo merge(ProgressInfo newer)
    {
        assert equals(newer) : "merging progress of different files: " + this + " and " + newer;
        return new ProgressInfo(peer, sessionIndex, fileName, direction,
                                currentBytes + newer.deltaBytes, newer.deltaBytes, totalBytes);
    }

    /**
     * @return true if transfer is completed
     */
    public boolean isCompleted()
    {
        return currentBytes >= totalBytes;
    }

    public int progressPercentage()
    {
        return totalBytes == 0 ? 100 : (int) ((100 * currentBytes) / totalBytes);
    }

    /**
     * ProgressInfo is considered to be equal only when all attributes except currentBytes and deltaBytes are equal.
     */
    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ProgressInfo that = (ProgressInfo) o;

        if (totalBytes != that.totalBytes) return false;
        if (direction != that.direction) return false;
        if (!fileName.equals(that.fileName)) return false;
        if (sessionIndex != that.sessionIndex) return false;
        return peer.equals(that.peer);
    }

    @Override
    public int hashCode()
    {
        return Objects.hashCode(peer, sessionIndex, fileName, direction, totalBytes);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(fileName);
        sb.append(" ").append(currentBytes);
        sb.append("/").append(totalBytes).append(" bytes ");
        sb.append("(").append(progressPercentage()).append("%) ");
        sb.append(direction == Direction.OUT ? "sent to " : "received from ");
        sb.append("idx:").append(sessionIndex);
        sb.append(peer);
        return sb.toString();
    }
}

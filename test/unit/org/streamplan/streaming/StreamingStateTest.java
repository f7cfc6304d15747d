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
import java.util.UUID;

import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.streamplan.streaming.MockStreamSession.peer;

public class StreamingStateTest
{
    private static final InetAddress PEER = peer(1);

    private UUID planId;
    private StreamingState state;

    @Before
    public void setUp()
    {
        planId = UUID.randomUUID();
        StreamCoordinator coordinator = new StreamCoordinator(0, MockStreamSession.FACTORY, true, false);
        state = new StreamingState(new StreamResultFuture(planId, "bootstrap", coordinator));
    }

    private SessionInfo session(StreamSession.State sessionState, int filesToReceive, long sizeToReceive, int filesToSend, long sizeToSend)
    {
        return new SessionInfo(PEER, 0, PEER, filesToReceive, sizeToReceive, filesToSend, sizeToSend, sessionState, null);
    }

    private void prepared(int filesToReceive, long sizeToReceive, int filesToSend, long sizeToSend)
    {
        SessionInfo info = session(StreamSession.State.PREPARED, filesToReceive, sizeToReceive, filesToSend, sizeToSend);
        state.handleStreamEvent(new StreamEvent.SessionPreparedEvent(planId, info));
    }

    private void progress(String file, ProgressInfo.Direction direction, long current, long delta, long total)
    {
        state.handleStreamEvent(new StreamEvent.ProgressEvent(planId, new ProgressInfo(PEER, 0, file, direction, current, delta, total)));
    }

    @Test
    public void testProgressFollowsTransferredBytes()
    {
        assertEquals(StreamingState.Status.INIT, state.status());
        assertEquals(0f, state.progress(), 0f);
        assertTrue(state.follower());

        state.start();
        prepared(1, 100, 1, 100);
        progress("in", ProgressInfo.Direction.IN, 100, 100, 100);

        assertEquals(0.5f, state.progress(), 0.001f);
        StreamingState.Sessions sessions = state.sessions();
        assertEquals(100, sessions.bytesReceived);
        assertEquals(1, sessions.filesReceived);
        assertEquals(0, sessions.filesSent);
        assertEquals(200, sessions.bytesToReceive + sessions.bytesToSend);
        assertThat(state.peers()).containsExactly(PEER);
    }

    @Test
    public void testRepeatedFinalReportsCountFileOnce()
    {
        state.start();
        prepared(2, 200, 0, 0);
        progress("a", ProgressInfo.Direction.IN, 100, 100, 100);
        progress("a", ProgressInfo.Direction.IN, 100, 0, 100);
        progress("a", ProgressInfo.Direction.IN, 100, 0, 100);

        StreamingState.Sessions sessions = state.sessions();
        assertEquals(1, sessions.filesReceived);
        assertEquals(100, sessions.bytesReceived);
    }

    @Test
    public void testCompletionFreezesCounts()
    {
        state.start();
        prepared(0, 0, 1, 50);
        progress("out", ProgressInfo.Direction.OUT, 20, 20, 50);

        SessionInfo failed = session(StreamSession.State.FAILED, 0, 0, 1, 50)
                             .withProgress(new ProgressInfo(PEER, 0, "out", ProgressInfo.Direction.OUT, 20, 20, 50));
        state.handleStreamEvent(new StreamEvent.SessionCompleteEvent(planId, failed));
        progress("out", ProgressInfo.Direction.OUT, 50, 30, 50);

        StreamingState.Sessions sessions = state.sessions();
        assertEquals(20, sessions.bytesSent);
        assertEquals(0, sessions.filesSent);
    }

    @Test
    public void testProgressIsCappedWhileRunning()
    {
        state.start();
        prepared(0, 0, 1, 10);
        progress("out", ProgressInfo.Direction.OUT, 10, 10, 10);

        assertEquals(0.99f, state.progress(), 0f);
        assertFalse(state.isComplete());

        state.onSuccess(new StreamState(planId, "bootstrap", ImmutableSet.of()));
        assertEquals(1f, state.progress(), 0f);
        assertTrue(state.isComplete());
        assertNull(state.failureCause());
        assertThat(state.stateTimesMillis()).containsKeys(StreamingState.Status.INIT,
                                                          StreamingState.Status.START,
                                                          StreamingState.Status.SUCCESS);
        assertThat(state.durationMillis()).isGreaterThanOrEqualTo(0);
    }

    @Test
    public void testProgressWithoutPreparedSessionIsIgnored()
    {
        state.start();
        progress("in", ProgressInfo.Direction.IN, 10, 10, 10);

        assertThat(state.peers()).isEmpty();
        assertEquals(0, state.sessions().bytesReceived);
    }

    @Test
    public void testFailureKeepsStreamExceptionMessage()
    {
        state.start();
        StreamState finalState = new StreamState(planId, "bootstrap", ImmutableSet.of());
        state.onFailure(new StreamException(finalState, "Stream #" + planId + " failed"));

        assertEquals(StreamingState.Status.FAILURE, state.status());
        assertEquals("Stream #" + planId + " failed", state.failureCause());
        assertThat(state.toString()).contains("status=failure");
    }

    @Test
    public void testFailureWithOtherCauseKeepsStackTrace()
    {
        state.onFailure(new IllegalStateException("unexpected"));

        assertThat(state.failureCause()).contains("java.lang.IllegalStateException: unexpected");
    }
}

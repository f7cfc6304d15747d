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

import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.streamplan.config.StreamingDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.streamplan.streaming.MockStreamSession.peer;

public class StreamResultFutureTest
{
    private static final InetAddress PEER_A = peer(1);
    private static final InetAddress PEER_B = peer(2);

    private StreamManager manager;

    @Before
    public void setUp()
    {
        manager = new StreamManager(StreamingDescriptor.defaults());
        manager.start();
    }

    @After
    public void tearDown()
    {
        manager.stop();
    }

    @Test
    public void testPlanWithoutSessionsSucceedsImmediately() throws Exception
    {
        StreamPlan plan = new StreamPlan(manager, "empty", MockStreamSession.FACTORY);
        assertTrue(plan.isEmpty());

        StreamResultFuture future = plan.execute();

        assertTrue(future.isDone());
        StreamState state = future.tryResult();
        assertEquals(plan.planId(), state.planId);
        assertThat(state.sessions).isEmpty();
        assertFalse(state.hasFailedSession());
        assertNull(manager.getInitiatorStream(plan.planId()));
    }

    @Test
    public void testSucceedsOnceEverySessionCompleted() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        MockStreamSession b = (MockStreamSession) plan.session(PEER_B);

        StreamResultFuture future = plan.execute();
        assertEquals(1, a.starts.get());
        assertEquals(1, b.starts.get());
        assertSame(future, manager.getInitiatorStream(plan.planId()));

        a.prepared(0, 0, 1, 100);
        b.prepared(2, 200, 0, 0);
        a.complete();
        assertFalse(future.isDone());
        assertNull(future.tryResult());

        b.complete();
        assertTrue(future.isDone());

        StreamState state = future.get();
        assertFalse(state.hasFailedSession());
        assertThat(state.sessions).hasSize(2)
                                  .allMatch(info -> info.state == StreamSession.State.COMPLETE);
        assertEquals(1, handler.successes.get());
        assertEquals(0, handler.failures.get());
        assertTrue(a.closedSuccessfully);
        assertTrue(b.closedSuccessfully);
        assertNull(manager.getInitiatorStream(plan.planId()));
    }

    @Test
    public void testFailedSessionFailsPlanWithFinalSnapshot() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "bootstrap", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        MockStreamSession b = (MockStreamSession) plan.session(PEER_B);
        StreamResultFuture future = plan.execute();

        a.prepared(0, 0, 1, 100);
        b.prepared(0, 0, 1, 100);
        a.complete();
        b.sessionFailed();

        assertTrue(future.isDone());
        try
        {
            future.tryResult();
            fail("expected the plan to fail");
        }
        catch (StreamException e)
        {
            assertThat(e.getMessage()).contains(plan.planId().toString())
                                      .contains("Remote peer " + PEER_B);
            assertTrue(e.finalState.hasFailedSession());
            assertThat(e.finalState.sessions).hasSize(2);
            for (SessionInfo info : e.finalState.sessions)
            {
                if (info.peer.equals(PEER_A))
                    assertEquals(StreamSession.State.COMPLETE, info.state);
                else
                    assertEquals(StreamSession.State.FAILED, info.state);
            }
        }

        assertThatThrownBy(future::get).isInstanceOf(ExecutionException.class)
                                       .hasCauseInstanceOf(StreamException.class);
        assertEquals(1, handler.failures.get());
        assertThat(handler.failure).isInstanceOf(StreamException.class);
        assertFalse(b.closedSuccessfully);
    }

    @Test
    public void testSessionFailingBeforePrepareFailsPlan()
    {
        StreamPlan plan = new StreamPlan(manager, "move", MockStreamSession.FACTORY);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        a.onError(new IOException("Connection refused"));

        assertTrue(future.isDone());
        assertThatThrownBy(future::tryResult).isInstanceOf(StreamException.class)
                                             .hasMessageContaining("Connection refused");
    }

    @Test
    public void testProgressNeverResolvesThePlan() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "rebuild", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        a.prepared(0, 0, 1, 100);
        a.startStreaming();
        a.progress("data-1", ProgressInfo.Direction.OUT, 50, 50, 100);
        a.progress("data-1", ProgressInfo.Direction.OUT, 100, 50, 100);
        assertFalse(future.isDone());

        SessionInfo running = future.getCurrentState().sessions.iterator().next();
        assertEquals(100, running.getTotalSizeSent());
        assertEquals(1, running.getTotalFilesSent());

        a.complete();
        SessionInfo done = future.get().sessions.iterator().next();
        assertEquals(100, done.getTotalSizeSent());
        assertEquals(StreamSession.State.COMPLETE, done.state);
        assertThat(handler.types()).containsExactly(StreamEvent.Type.STREAM_PREPARED,
                                                    StreamEvent.Type.FILE_PROGRESS,
                                                    StreamEvent.Type.FILE_PROGRESS,
                                                    StreamEvent.Type.STREAM_COMPLETE);
    }

    @Test
    public void testProgressOfUnpreparedSessionIsRejected()
    {
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        assertThatThrownBy(() -> a.progress("data-1", ProgressInfo.Direction.IN, 10, 10, 100))
            .isInstanceOf(IllegalStateException.class);
        SessionInfo info = future.getCurrentState().sessions.iterator().next();
        assertEquals(StreamSession.State.INITIALIZED, info.state);
        assertEquals(0, info.getTotalSizeReceived());
    }

    @Test
    public void testResolutionHappensOnce() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();
        a.prepared(0, 0, 0, 0);
        a.complete();
        StreamState first = future.get();

        future.maybeComplete();
        future.maybeComplete();
        a.complete();
        a.onError(new IOException("late"));

        assertSame(first, future.get());
        assertEquals(1, handler.successes.get());
        assertEquals(0, handler.failures.get());
        assertFalse(future.cancel(true));
        assertFalse(future.isCancelled());
    }

    @Test
    public void testListenersReceiveEventsInOrder()
    {
        RecordingEventHandler first = new RecordingEventHandler();
        RecordingEventHandler second = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(first, second);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        plan.execute();

        a.prepared(1, 10, 0, 0);
        a.progress("data-1", ProgressInfo.Direction.IN, 10, 10, 10);
        a.complete();

        List<StreamEvent.Type> expected = new ArrayList<>();
        expected.add(StreamEvent.Type.STREAM_PREPARED);
        expected.add(StreamEvent.Type.FILE_PROGRESS);
        expected.add(StreamEvent.Type.STREAM_COMPLETE);
        assertEquals(expected, first.types());
        assertEquals(expected, second.types());

        StreamEvent.SessionCompleteEvent complete = (StreamEvent.SessionCompleteEvent) first.events.get(2);
        assertTrue(complete.success);
        assertEquals(PEER_A, complete.peer);
        assertEquals(10, complete.session.getTotalSizeReceived());
    }

    @Test
    public void testThrowingListenerDoesNotAffectOthers() throws Exception
    {
        StreamEventHandler throwing = new RecordingEventHandler()
        {
            @Override
            public void handleStreamEvent(StreamEvent event)
            {
                throw new RuntimeException("listener failure");
            }
        };
        RecordingEventHandler recording = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(throwing, recording);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        a.prepared(0, 0, 1, 10);
        a.complete();

        assertThat(recording.types()).containsExactly(StreamEvent.Type.STREAM_PREPARED, StreamEvent.Type.STREAM_COMPLETE);
        assertFalse(future.get().hasFailedSession());
    }

    @Test
    public void testLateListenerGetsCompletionWithoutReplay() throws Exception
    {
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();
        a.prepared(0, 0, 1, 10);
        a.complete();

        RecordingEventHandler late = new RecordingEventHandler();
        future.addEventListener(late);

        assertThat(late.events).isEmpty();
        assertEquals(1, late.successes.get());
        assertSame(future.get(), late.result);
    }

    @Test
    public void testSessionCompletingDuringStartDoesNotResolveEarly() throws Exception
    {
        StreamSession.Factory factory = (peer, index, follower) -> new MockStreamSession(peer, index, follower)
        {
            @Override
            public void start()
            {
                super.start();
                prepared(0, 0, 1, 10);
                startStreaming();
                progress("data-" + peer.getHostAddress(), ProgressInfo.Direction.OUT, 10, 10, 10);
                complete();
            }
        };
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", factory).listeners(handler);
        plan.session(PEER_A);
        plan.session(PEER_B);

        StreamResultFuture future = plan.execute();

        StreamState state = future.get(10, TimeUnit.SECONDS);
        assertThat(state.sessions).hasSize(2)
                                  .allMatch(info -> info.state == StreamSession.State.COMPLETE && info.getTotalSizeSent() == 10);
        assertEquals(1, handler.successes.get());
        assertThat(handler.types()).filteredOn(type -> type == StreamEvent.Type.STREAM_COMPLETE).hasSize(2);
    }

    @Test
    public void testConcurrentCompletionsResolveOnce() throws Exception
    {
        int sessions = 16;
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        List<MockStreamSession> all = new ArrayList<>();
        for (int i = 0; i < sessions; i++)
            all.add((MockStreamSession) plan.session(peer(10 + i)));
        StreamResultFuture future = plan.execute();
        for (MockStreamSession session : all)
            session.prepared(0, 0, 1, 10);

        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (MockStreamSession session : all)
        {
            Thread thread = new Thread(() -> {
                try
                {
                    go.await();
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    return;
                }
                session.complete();
            });
            thread.start();
            threads.add(thread);
        }
        go.countDown();
        for (Thread thread : threads)
            thread.join(TimeUnit.SECONDS.toMillis(10));

        StreamState state = future.get(10, TimeUnit.SECONDS);
        assertThat(state.sessions).hasSize(sessions)
                                  .allMatch(info -> info.state == StreamSession.State.COMPLETE);
        assertEquals(1, handler.successes.get());
        assertThat(handler.types()).filteredOn(type -> type == StreamEvent.Type.STREAM_COMPLETE).hasSize(sessions);
    }

    @Test
    public void testProgressOfClosedSessionIsNotPublished() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        MockStreamSession b = (MockStreamSession) plan.session(PEER_B);
        StreamResultFuture future = plan.execute();
        a.prepared(0, 0, 1, 100);
        b.prepared(0, 0, 1, 100);
        a.progress("data-1", ProgressInfo.Direction.OUT, 40, 40, 100);
        a.complete();
        int eventsBefore = handler.events.size();

        a.progress("data-1", ProgressInfo.Direction.OUT, 100, 60, 100);

        assertEquals(eventsBefore, handler.events.size());
        assertEquals(40, manager.metrics().totalOutgoingBytes.getCount());
        assertEquals(40, future.getCurrentState().sessions.iterator().next().getTotalSizeSent());
    }

    @Test
    public void testSessionClosedWhilePrepareWaitsIsNotReportedPrepared() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        AtomicReference<Throwable> prepareError = new AtomicReference<>();
        Thread preparing = new Thread(() -> {
            try
            {
                a.prepared(1, 10, 0, 0);
            }
            catch (Throwable t)
            {
                prepareError.set(t);
            }
        });

        synchronized (future)
        {
            preparing.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (preparing.getState() != Thread.State.BLOCKED && System.nanoTime() < deadline)
                Thread.sleep(1);
            assertEquals(Thread.State.BLOCKED, preparing.getState());

            a.onError(new IOException("connection reset"));
        }
        preparing.join(TimeUnit.SECONDS.toMillis(10));

        assertNull(prepareError.get());
        assertThat(handler.types()).containsExactly(StreamEvent.Type.STREAM_COMPLETE);
        assertEquals(1, handler.failures.get());
        assertThatThrownBy(future::tryResult).isInstanceOf(StreamException.class);
        assertEquals(StreamSession.State.FAILED, future.getCurrentState().sessions.iterator().next().state);
    }

    @Test
    public void testPrepareAfterErrorIsIgnored() throws Exception
    {
        RecordingEventHandler handler = new RecordingEventHandler();
        StreamPlan plan = new StreamPlan(manager, "repair", MockStreamSession.FACTORY).listeners(handler);
        MockStreamSession a = (MockStreamSession) plan.session(PEER_A);
        StreamResultFuture future = plan.execute();

        a.onError(new IOException("connection refused"));
        a.prepared(1, 10, 0, 0);
        a.startStreaming();

        assertEquals(StreamSession.State.FAILED, a.state());
        assertThat(handler.types()).containsExactly(StreamEvent.Type.STREAM_COMPLETE);
        assertTrue(future.isDone());
    }

    @Test
    public void testEqualityByPlanId()
    {
        UUID planId = UUID.randomUUID();
        StreamResultFuture one = new StreamResultFuture(planId, "one", new StreamCoordinator(1, MockStreamSession.FACTORY, false, false));
        StreamResultFuture two = new StreamResultFuture(planId, "two", new StreamCoordinator(1, MockStreamSession.FACTORY, false, false));
        assertEquals(one, two);
        assertEquals(one.hashCode(), two.hashCode());
    }
}

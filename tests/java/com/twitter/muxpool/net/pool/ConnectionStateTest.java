// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.muxpool.net.pool;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.easymock.Capture;
import org.junit.Before;
import org.junit.Test;

import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;
import com.twitter.muxpool.testing.easymock.EasyMockTest;
import com.twitter.muxpool.util.testing.FakeClock;

import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ConnectionStateTest extends EasyMockTest {
  private static final Amount<Long, Time> IDLE_TIMEOUT = Amount.of(1L, Time.SECONDS);

  private FakeClock clock;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> timer;
  private Runnable onIdle;
  private FakeTransport transport;
  private Capture<Runnable> tick;

  @Before
  public void setUp() {
    clock = new FakeClock();
    scheduler = createMock(ScheduledExecutorService.class);
    timer = createMock(ScheduledFuture.class);
    onIdle = createMock(Runnable.class);
    transport = new FakeTransport("a");
    tick = createCapture();
  }

  private void expectSchedule(long delayMillis) {
    scheduler.schedule(capture(tick), eq(delayMillis), eq(TimeUnit.MILLISECONDS));
    expectLastCall().andReturn(timer);
  }

  private ConnectionState<FakeTransport> createArmedState() {
    ConnectionState<FakeTransport> state = ConnectionState.create(transport, clock, scheduler);
    state.delayClose(IDLE_TIMEOUT, onIdle);
    return state;
  }

  private void goIdle() {
    transport.openStream();
    transport.closeStream();
  }

  @Test
  public void testEvictsOnceIdleForFullTimeout() {
    expectSchedule(1000L);
    onIdle.run();
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    goIdle();
    assertFalse(state.isActive());

    clock.advanceMillis(1000L);
    tick.getValue().run();

    assertTrue(state.isRetired());
    assertNull(state.tryActivate());
  }

  @Test
  public void testRearmsForRemainderWhenIdleMidWindow() {
    expectSchedule(1000L);
    expectSchedule(400L);
    onIdle.run();
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    clock.advanceMillis(400L);
    goIdle();

    clock.advanceMillis(600L);
    tick.getValue().run();
    assertFalse("Idle for only 600ms", state.isRetired());

    clock.advanceMillis(400L);
    tick.getValue().run();
    assertTrue(state.isRetired());
  }

  @Test
  public void testActiveTransportGetsFullWindow() {
    expectSchedule(1000L);
    expectLastCall().times(2);
    expectSchedule(500L);
    onIdle.run();
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    transport.openStream();

    clock.advanceMillis(1000L);
    tick.getValue().run();
    assertTrue(state.isActive());

    clock.advanceMillis(500L);
    transport.closeStream();

    clock.advanceMillis(500L);
    tick.getValue().run();
    assertFalse(state.isRetired());

    clock.advanceMillis(500L);
    tick.getValue().run();
    assertTrue(state.isRetired());
  }

  @Test
  public void testBurstyTransportNeverEvicted() {
    expectSchedule(1000L);
    expectSchedule(800L);
    expectLastCall().times(10);
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    goIdle();
    for (int i = 0; i < 10; i++) {
      // Each tick finds the transport idle for only 200ms.
      clock.advanceMillis(i == 0 ? 800L : 600L);
      goIdle();
      clock.advanceMillis(200L);
      tick.getValue().run();
    }
    assertFalse(state.isRetired());
  }

  @Test
  public void testActivationResetsIdleClock() {
    expectSchedule(1000L);
    expectLastCall().times(2);
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    goIdle();

    clock.advanceMillis(900L);
    assertSame(transport, state.tryActivate());

    clock.advanceMillis(100L);
    tick.getValue().run();
    assertFalse(state.isRetired());
    assertTrue(state.isActive());
  }

  @Test
  public void testIdleTimeoutFloor() {
    expectSchedule(100L);
    control.replay();

    ConnectionState<FakeTransport> state = ConnectionState.create(transport, clock, scheduler);
    state.delayClose(Amount.of(10L, Time.MILLISECONDS), onIdle);
    assertEquals(100L, state.getIdleTimeoutMillis());
  }

  @Test
  public void testDisposeCancelsTimerAndFinishesOnce() {
    expectSchedule(1000L);
    expect(timer.cancel(false)).andReturn(true);
    control.replay();

    ConnectionState<FakeTransport> state = createArmedState();
    state.dispose();
    state.dispose();

    assertTrue(state.isRetired());
    assertEquals(1, transport.getFinishCount());

    // A tick that raced the cancel must neither rearm nor evict.
    clock.advanceMillis(5000L);
    tick.getValue().run();
  }

  @Test
  public void testDisposeUnsubscribesFromTransport() {
    control.replay();

    ConnectionState<FakeTransport> state = ConnectionState.create(transport, clock, scheduler);
    state.dispose();

    transport.openStream();
    transport.closeStream();
    assertTrue("Idle signal after dispose should be ignored", state.isActive());
  }

  @Test(expected = IllegalStateException.class)
  public void testArmTwice() {
    expectSchedule(1000L);
    control.replay();

    createArmedState().delayClose(IDLE_TIMEOUT, onIdle);
  }
}

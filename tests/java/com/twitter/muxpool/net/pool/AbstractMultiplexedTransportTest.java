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

import org.junit.Before;
import org.junit.Test;

import com.twitter.muxpool.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertEquals;

public class AbstractMultiplexedTransportTest extends EasyMockTest {
  private ActiveStateListener listener;
  private FakeTransport transport;

  @Before
  public void setUp() {
    listener = createMock(ActiveStateListener.class);
    transport = new FakeTransport("transport");
    transport.addActiveStateListener(listener);
  }

  @Test
  public void testNotifiesOnlyOnTransitions() {
    listener.onActiveStateChanged(true);
    listener.onActiveStateChanged(false);
    listener.onActiveStateChanged(true);
    control.replay();

    transport.openStream();
    transport.openStream();
    transport.openStream();
    assertEquals(3, transport.getOpenStreams());
    transport.closeStream();
    transport.closeStream();
    transport.closeStream();
    assertEquals(0, transport.getOpenStreams());
    transport.openStream();
  }

  @Test
  public void testRemovedListenerNotNotified() {
    control.replay();

    transport.removeActiveStateListener(listener);
    transport.openStream();
    transport.closeStream();
  }

  @Test
  public void testFailingListenerDoesNotStopOthers() {
    ActiveStateListener second = createMock(ActiveStateListener.class);
    listener.onActiveStateChanged(true);
    expectLastCall().andThrow(new IllegalStateException("listener bug"));
    second.onActiveStateChanged(true);
    control.replay();

    transport.addActiveStateListener(second);
    transport.openStream();
  }

  @Test(expected = IllegalStateException.class)
  public void testCloseWithoutOpenStream() {
    control.replay();

    transport.closeStream();
  }
}

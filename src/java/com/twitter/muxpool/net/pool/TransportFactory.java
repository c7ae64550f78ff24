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

import java.io.IOException;

import javax.net.ssl.SSLSocket;

/**
 * Wraps an established TLS channel in the multiplexing protocol implementation.
 *
 * @param <T> the transport type produced
 */
public interface TransportFactory<T extends MultiplexedTransport> {

  /**
   * @param socket a socket whose TLS handshake has completed
   * @return a transport that owns {@code socket}
   * @throws IOException if the protocol preface could not be exchanged
   */
  T wrap(SSLSocket socket) throws IOException;
}

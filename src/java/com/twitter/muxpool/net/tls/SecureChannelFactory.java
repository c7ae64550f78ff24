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

package com.twitter.muxpool.net.tls;

import java.io.IOException;
import java.net.Socket;

import javax.net.ssl.SSLSocket;

import com.twitter.muxpool.net.Authority;
import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;

/**
 * Creates TLS channels that negotiate the multiplexed application protocol.
 */
public interface SecureChannelFactory {

  /**
   * Connects to {@code target} and completes a TLS handshake with it.
   *
   * @param target the authority to connect to
   * @param connectTimeout bound on the socket connect; non-positive waits indefinitely
   * @param setting trust and certificate policy for this attempt
   * @return a socket whose handshake has completed
   * @throws IOException if connecting or the handshake fails
   */
  SSLSocket connect(Authority target, Amount<Long, Time> connectTimeout, ClientSetting setting)
      throws IOException;

  /**
   * Layers TLS over an already connected socket, validating the certificate against
   * {@code target} rather than the peer the socket is physically connected to.  Closing the
   * returned socket closes {@code connected}.
   *
   * @param connected a connected plain socket, eg: a proxy tunnel
   * @param target the authority at the far end of the tunnel
   * @param setting trust and certificate policy for this attempt
   * @return a socket whose handshake has completed
   * @throws IOException if the handshake fails
   */
  SSLSocket secure(Socket connected, Authority target, ClientSetting setting) throws IOException;
}

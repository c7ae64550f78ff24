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
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.net.ssl.SSLSocket;

import com.google.common.base.Preconditions;

import com.twitter.muxpool.net.Authority;
import com.twitter.muxpool.net.ConnectTimeoutException;
import com.twitter.muxpool.net.ProxyTarget;
import com.twitter.muxpool.net.ProxyTunnel;
import com.twitter.muxpool.net.SocketTimeouts;
import com.twitter.muxpool.net.tls.ClientSetting;
import com.twitter.muxpool.net.tls.JsseSecureChannelFactory;
import com.twitter.muxpool.net.tls.SecureChannelFactory;

/**
 * Establishes transports over TLS, either directly to the target or through an HTTP proxy tunnel
 * when the attempt's {@link ClientSetting} names a proxy.
 *
 * @param <T> the transport type produced
 */
public class SecureTransportEstablisher<T extends MultiplexedTransport>
    implements TransportEstablisher<T> {

  private static final Logger LOG = Logger.getLogger(SecureTransportEstablisher.class.getName());

  private final SecureChannelFactory channelFactory;
  private final TransportFactory<T> transportFactory;
  private final ProxyTunnel proxyTunnel;

  public SecureTransportEstablisher(SecureChannelFactory channelFactory,
      TransportFactory<T> transportFactory, ProxyTunnel proxyTunnel) {
    this.channelFactory = Preconditions.checkNotNull(channelFactory);
    this.transportFactory = Preconditions.checkNotNull(transportFactory);
    this.proxyTunnel = Preconditions.checkNotNull(proxyTunnel);
  }

  /**
   * Creates an establisher using JSSE and the JVM default socket factory.
   */
  public static <T extends MultiplexedTransport> SecureTransportEstablisher<T> create(
      TransportFactory<T> transportFactory) {
    return new SecureTransportEstablisher<T>(
        new JsseSecureChannelFactory(), transportFactory, new ProxyTunnel());
  }

  @Override
  public T establish(ConnectionRequest request, ClientSetting setting) throws IOException {
    Preconditions.checkNotNull(request);
    Preconditions.checkNotNull(setting);

    Authority target = request.getAuthority();
    ProxyTarget proxy = setting.getProxy();
    SSLSocket socket = proxy == null
        ? connectDirect(request, setting)
        : connectViaProxy(request, proxy, setting);

    T transport;
    try {
      transport = transportFactory.wrap(socket);
    } catch (IOException e) {
      closeQuietly(socket);
      throw e;
    } catch (RuntimeException e) {
      closeQuietly(socket);
      throw e;
    }
    LOG.fine("Established transport to " + target + (proxy == null ? "" : " via proxy " + proxy));
    return transport;
  }

  private SSLSocket connectDirect(ConnectionRequest request, ClientSetting setting)
      throws IOException {
    try {
      return channelFactory.connect(request.getAuthority(), request.getConnectTimeout(), setting);
    } catch (SocketTimeoutException e) {
      throw new ConnectTimeoutException("Connecting to " + request.getAuthority() + " timed out ["
          + SocketTimeouts.toMillis(request.getConnectTimeout()) + "ms]", e);
    }
  }

  private SSLSocket connectViaProxy(ConnectionRequest request, ProxyTarget proxy,
      ClientSetting setting) throws IOException {
    Socket tunnel = proxyTunnel.open(request.getAuthority(), proxy, request.getConnectTimeout());
    try {
      return channelFactory.secure(tunnel, request.getAuthority(), setting);
    } catch (IOException e) {
      closeQuietly(tunnel);
      throw e;
    }
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LOG.log(Level.FINE, "Failed to close socket " + socket, e);
    }
  }
}

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

package com.twitter.muxpool.net;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.net.SocketFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;

import org.apache.commons.codec.binary.Base64;

import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;

/**
 * Opens a plain socket to an HTTP proxy and asks it to relay bytes to a target authority with an
 * HTTP/1.1 {@code CONNECT}.  The returned socket is still plain; the caller negotiates TLS with
 * the target over it.
 *
 * <p>The exchange is one-shot: only the first line of the first chunk the proxy sends is looked
 * at, since a compliant proxy leads with its status line.  A single read is made, so any part of
 * the reply that arrives after that first chunk, such as trailing headers or the blank line ending
 * the reply, stays unread on the socket and reaches the TLS handshake that follows.  Proxies that
 * split their reply across segments are not supported.
 */
public class ProxyTunnel {
  private static final Logger LOG = Logger.getLogger(ProxyTunnel.class.getName());

  private static final String CRLF = "\r\n";
  private static final String TUNNEL_ESTABLISHED = "HTTP/1.1 200";
  private static final int RESPONSE_CHUNK_SIZE = 8192;

  private final SocketFactory socketFactory;

  /**
   * Creates a tunnel opener that dials proxies with the JVM default socket factory.
   */
  public ProxyTunnel() {
    this(SocketFactory.getDefault());
  }

  public ProxyTunnel(SocketFactory socketFactory) {
    this.socketFactory = Preconditions.checkNotNull(socketFactory);
  }

  /**
   * Connects to {@code proxy} and establishes a tunnel to {@code target}.
   *
   * @param target the authority the tunnel should reach
   * @param proxy the proxy to tunnel through
   * @param connectTimeout bound on connecting to the proxy and on awaiting its reply; a
   *     non-positive amount waits indefinitely
   * @return a connected plain socket whose bytes are relayed to {@code target}
   * @throws ConnectTimeoutException if the proxy could not be connected within the bound
   * @throws ProxyTunnelException if the proxy refused the tunnel or its reply could not be read
   * @throws IOException if connecting to the proxy failed for another reason
   */
  public Socket open(Authority target, ProxyTarget proxy, Amount<Long, Time> connectTimeout)
      throws IOException {
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(proxy);
    Preconditions.checkNotNull(connectTimeout);

    int timeoutMs = SocketTimeouts.toMillis(connectTimeout);
    Socket socket = socketFactory.createSocket();
    boolean tunneled = false;
    try {
      try {
        socket.connect(proxy.getAuthority().toSocketAddress(), timeoutMs);
      } catch (SocketTimeoutException e) {
        throw new ConnectTimeoutException(
            "Connecting to proxy " + proxy + " timed out [" + timeoutMs + "ms]", e);
      }

      OutputStream out = socket.getOutputStream();
      out.write(connectRequest(target, proxy).getBytes(Charsets.US_ASCII));
      out.flush();

      String statusLine = readStatusLine(socket, proxy, timeoutMs);
      if (!statusLine.startsWith(TUNNEL_ESTABLISHED)) {
        throw new ProxyTunnelException(proxy, statusLine);
      }
      LOG.fine("Tunnel to " + target + " established via proxy " + proxy);
      tunneled = true;
      return socket;
    } finally {
      if (!tunneled) {
        closeQuietly(socket);
      }
    }
  }

  @VisibleForTesting
  static String connectRequest(Authority target, ProxyTarget proxy) {
    StringBuilder request = new StringBuilder()
        .append("CONNECT ").append(target).append(" HTTP/1.1").append(CRLF)
        .append("Host: ").append(target);
    if (proxy.hasCredentials()) {
      String credentials = Base64.encodeBase64String(proxy.getUserInfo().getBytes(Charsets.UTF_8));
      request.append(CRLF).append("Proxy-Authorization: Basic ").append(credentials.trim());
    }
    return request.append(CRLF).append(CRLF).toString();
  }

  private static String readStatusLine(Socket socket, ProxyTarget proxy, int timeoutMs)
      throws ProxyTunnelException {
    byte[] chunk = new byte[RESPONSE_CHUNK_SIZE];
    int read;
    try {
      socket.setSoTimeout(timeoutMs);
      InputStream in = socket.getInputStream();
      read = in.read(chunk);
      // The tunnel is handed off for TLS, which manages its own reads.
      socket.setSoTimeout(0);
    } catch (IOException e) {
      throw new ProxyTunnelException("Failed reading tunnel reply from proxy " + proxy, e);
    }
    if (read == -1) {
      throw new ProxyTunnelException("Proxy " + proxy + " closed the connection before replying",
          null);
    }

    String response = new String(chunk, 0, read, Charsets.US_ASCII);
    int lineEnd = response.indexOf(CRLF);
    return lineEnd == -1 ? response : response.substring(0, lineEnd);
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LOG.log(Level.FINE, "Failed to close abandoned proxy socket " + socket, e);
    }
  }
}

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
import java.security.GeneralSecurityException;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import com.twitter.muxpool.net.Authority;
import com.twitter.muxpool.net.SocketTimeouts;
import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;

/**
 * A {@link SecureChannelFactory} backed by JSSE.  Channels advertise {@code h2} via ALPN and
 * verify the server certificate against the target host name.
 */
public class JsseSecureChannelFactory implements SecureChannelFactory {
  private static final Logger LOG = Logger.getLogger(JsseSecureChannelFactory.class.getName());

  /**
   * The ALPN identifier of HTTP/2 over TLS.
   */
  public static final String H2 = "h2";

  private static final String ENDPOINT_IDENTIFICATION = "HTTPS";

  private final SocketFactory plainSocketFactory;

  public JsseSecureChannelFactory() {
    this(SocketFactory.getDefault());
  }

  public JsseSecureChannelFactory(SocketFactory plainSocketFactory) {
    this.plainSocketFactory = Preconditions.checkNotNull(plainSocketFactory);
  }

  @Override
  public SSLSocket connect(Authority target, Amount<Long, Time> connectTimeout,
      ClientSetting setting) throws IOException {
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(connectTimeout);
    Preconditions.checkNotNull(setting);

    Socket socket = plainSocketFactory.createSocket();
    try {
      socket.connect(target.toSocketAddress(), SocketTimeouts.toMillis(connectTimeout));
    } catch (IOException e) {
      closeQuietly(socket);
      throw e;
    }
    return secure(socket, target, setting);
  }

  @Override
  public SSLSocket secure(Socket connected, Authority target, ClientSetting setting)
      throws IOException {
    Preconditions.checkNotNull(connected);
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(setting);

    SSLSocket socket;
    try {
      socket = (SSLSocket) createContext(target, setting).getSocketFactory()
          .createSocket(connected, target.getHost(), target.getPort(), true);
    } catch (IOException e) {
      closeQuietly(connected);
      throw e;
    }

    socket.setSSLParameters(h2Parameters(socket.getSSLParameters()));
    try {
      socket.startHandshake();
    } catch (IOException e) {
      closeQuietly(socket);
      throw e;
    }
    LOG.fine("TLS established with " + target + ", protocol: " + socket.getApplicationProtocol());
    return socket;
  }

  @VisibleForTesting
  static SSLParameters h2Parameters(SSLParameters parameters) {
    parameters.setApplicationProtocols(new String[] {H2});
    parameters.setEndpointIdentificationAlgorithm(ENDPOINT_IDENTIFICATION);
    return parameters;
  }

  @VisibleForTesting
  static SSLContext createContext(Authority target, ClientSetting setting) throws SSLException {
    try {
      if (setting.getTrustStore() == null && setting.getBadCertificateHandler() == null) {
        return SSLContext.getDefault();
      }

      TrustManagerFactory trustManagerFactory =
          TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      trustManagerFactory.init(setting.getTrustStore());
      TrustManager[] trustManagers = trustManagerFactory.getTrustManagers();

      BadCertificateHandler handler = setting.getBadCertificateHandler();
      if (handler != null) {
        for (int i = 0; i < trustManagers.length; i++) {
          if (trustManagers[i] instanceof X509ExtendedTrustManager) {
            trustManagers[i] = new PolicyTrustManager(
                (X509ExtendedTrustManager) trustManagers[i], handler, target.getHost());
          }
        }
      }

      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, trustManagers, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new SSLException("Failed to set up TLS for " + target, e);
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

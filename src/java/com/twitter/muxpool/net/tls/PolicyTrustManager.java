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

import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.logging.Logger;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

import com.google.common.base.Preconditions;

/**
 * A trust manager that defers to a standard delegate and, when the delegate rejects a server
 * chain, gives a {@link BadCertificateHandler} the final say on the leaf certificate.
 */
class PolicyTrustManager extends X509ExtendedTrustManager {
  private static final Logger LOG = Logger.getLogger(PolicyTrustManager.class.getName());

  private final X509ExtendedTrustManager delegate;
  private final BadCertificateHandler handler;
  private final String host;

  PolicyTrustManager(X509ExtendedTrustManager delegate, BadCertificateHandler handler,
      String host) {
    this.delegate = Preconditions.checkNotNull(delegate);
    this.handler = Preconditions.checkNotNull(handler);
    this.host = Preconditions.checkNotNull(host);
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
      throws CertificateException {
    try {
      delegate.checkServerTrusted(chain, authType, socket);
    } catch (CertificateException e) {
      overrule(chain, e);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
      throws CertificateException {
    try {
      delegate.checkServerTrusted(chain, authType, engine);
    } catch (CertificateException e) {
      overrule(chain, e);
    }
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
    try {
      delegate.checkServerTrusted(chain, authType);
    } catch (CertificateException e) {
      overrule(chain, e);
    }
  }

  private void overrule(X509Certificate[] chain, CertificateException rejection)
      throws CertificateException {
    if (chain == null || chain.length == 0 || !handler.accept(chain[0], host)) {
      throw rejection;
    }
    LOG.warning("Accepting untrusted certificate for " + host + " ("
        + chain[0].getSubjectX500Principal() + "): " + rejection.getMessage());
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType, socket);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType, engine);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
    delegate.checkClientTrusted(chain, authType);
  }

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return delegate.getAcceptedIssuers();
  }
}

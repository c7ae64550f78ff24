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

import java.security.KeyStore;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.twitter.muxpool.net.ProxyTarget;

/**
 * Mutable settings for a single connection attempt.  A fresh instance is created per attempt and
 * handed to the {@link ClientSettingCustomizer}, if any.
 */
public class ClientSetting {
  @Nullable private KeyStore trustStore;
  @Nullable private BadCertificateHandler badCertificateHandler;
  @Nullable private ProxyTarget proxy;

  /**
   * Returns the trusted certificates, or {@code null} to use the JVM's default trust store.
   */
  @Nullable
  public KeyStore getTrustStore() {
    return trustStore;
  }

  public void setTrustStore(@Nullable KeyStore trustStore) {
    this.trustStore = trustStore;
  }

  /**
   * Returns the handler consulted for certificates that fail validation, or {@code null} to
   * reject them.
   */
  @Nullable
  public BadCertificateHandler getBadCertificateHandler() {
    return badCertificateHandler;
  }

  public void setBadCertificateHandler(@Nullable BadCertificateHandler badCertificateHandler) {
    this.badCertificateHandler = badCertificateHandler;
  }

  /**
   * Returns the proxy to tunnel through, or {@code null} to connect directly.
   */
  @Nullable
  public ProxyTarget getProxy() {
    return proxy;
  }

  public void setProxy(@Nullable ProxyTarget proxy) {
    this.proxy = proxy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("customTrust", trustStore != null)
        .add("badCertificateHandler", badCertificateHandler)
        .add("proxy", proxy)
        .toString();
  }
}

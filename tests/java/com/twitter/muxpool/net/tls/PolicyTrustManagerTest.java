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

import javax.net.ssl.X509ExtendedTrustManager;
import javax.security.auth.x500.X500Principal;

import org.junit.Before;
import org.junit.Test;

import com.twitter.muxpool.testing.easymock.EasyMockTest;

import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class PolicyTrustManagerTest extends EasyMockTest {
  private static final String HOST = "api.example.com";
  private static final String AUTH_TYPE = "RSA";

  private X509ExtendedTrustManager delegate;
  private BadCertificateHandler handler;
  private X509Certificate leaf;
  private X509Certificate[] chain;
  private PolicyTrustManager trustManager;

  @Before
  public void setUp() {
    delegate = createMock(X509ExtendedTrustManager.class);
    handler = createMock(BadCertificateHandler.class);
    leaf = createMock(X509Certificate.class);
    chain = new X509Certificate[] {leaf};
    trustManager = new PolicyTrustManager(delegate, handler, HOST);
  }

  @Test
  public void testTrustedChainSkipsHandler() throws Exception {
    delegate.checkServerTrusted(chain, AUTH_TYPE);
    control.replay();

    trustManager.checkServerTrusted(chain, AUTH_TYPE);
  }

  @Test
  public void testHandlerOverrulesRejection() throws Exception {
    delegate.checkServerTrusted(chain, AUTH_TYPE);
    expectLastCall().andThrow(new CertificateException("self signed"));
    expect(handler.accept(leaf, HOST)).andReturn(true);
    expect(leaf.getSubjectX500Principal()).andReturn(new X500Principal("CN=" + HOST));
    control.replay();

    trustManager.checkServerTrusted(chain, AUTH_TYPE);
  }

  @Test
  public void testHandlerUpholdsRejection() throws Exception {
    CertificateException rejection = new CertificateException("expired");
    Socket socket = new Socket();
    delegate.checkServerTrusted(chain, AUTH_TYPE, socket);
    expectLastCall().andThrow(rejection);
    expect(handler.accept(leaf, HOST)).andReturn(false);
    control.replay();

    try {
      trustManager.checkServerTrusted(chain, AUTH_TYPE, socket);
      fail("Expected the rejection to stand");
    } catch (CertificateException e) {
      assertSame(rejection, e);
    }
  }

  @Test
  public void testEmptyChainNeverOverruled() throws Exception {
    CertificateException rejection = new CertificateException("empty chain");
    X509Certificate[] empty = new X509Certificate[0];
    delegate.checkServerTrusted(empty, AUTH_TYPE);
    expectLastCall().andThrow(rejection);
    control.replay();

    try {
      trustManager.checkServerTrusted(empty, AUTH_TYPE);
      fail("Expected the rejection to stand");
    } catch (CertificateException e) {
      assertSame(rejection, e);
    }
  }

  @Test
  public void testClientChecksDelegated() throws Exception {
    CertificateException rejection = new CertificateException("client rejected");
    delegate.checkClientTrusted(chain, AUTH_TYPE);
    expectLastCall().andThrow(rejection);
    X509Certificate[] issuers = new X509Certificate[0];
    expect(delegate.getAcceptedIssuers()).andReturn(issuers);
    control.replay();

    try {
      trustManager.checkClientTrusted(chain, AUTH_TYPE);
      fail("Expected client checks to bypass the handler");
    } catch (CertificateException e) {
      assertSame(rejection, e);
    }
    assertSame(issuers, trustManager.getAcceptedIssuers());
  }
}

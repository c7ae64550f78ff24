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

import java.net.URI;

import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class AuthorityTest {

  private static Authority fromUri(String uri) {
    return Authority.fromUri(URI.create(uri));
  }

  @Test
  public void testDefaultPorts() {
    assertEquals(Authority.of("example.com", 443), fromUri("https://example.com/a/b?c=d"));
    assertEquals(Authority.of("example.com", 443), fromUri("wss://example.com/socket"));
    assertEquals(Authority.of("example.com", 80), fromUri("http://example.com"));
    assertEquals(Authority.of("example.com", 80), fromUri("ws://example.com/"));
    assertEquals(Authority.of("example.com", 443), fromUri("HTTPS://example.com/"));
  }

  @Test
  public void testExplicitPort() {
    assertEquals(Authority.of("example.com", 8443), fromUri("https://example.com:8443/"));
    assertEquals(Authority.of("example.com", 9000), fromUri("ftp://example.com:9000/"));
  }

  @Test
  public void testPathAndQueryIgnored() {
    assertEquals(fromUri("https://example.com/one"), fromUri("https://example.com/two?x=1#y"));
  }

  @Test
  public void testHostCaseIgnored() {
    assertEquals(fromUri("https://example.com/"), fromUri("https://Example.COM/"));
    assertEquals("example.com:8443", Authority.of("EXAMPLE.com", 8443).toString());
  }

  @Test
  public void testEquality() {
    new EqualsTester()
        .addEqualityGroup(Authority.of("a.example.com", 443), fromUri("https://a.example.com"),
            Authority.of("A.Example.com", 443))
        .addEqualityGroup(Authority.of("a.example.com", 8443))
        .addEqualityGroup(Authority.of("b.example.com", 443))
        .testEquals();
  }

  @Test
  public void testToString() {
    assertEquals("example.com:443", fromUri("https://example.com/").toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoHost() {
    fromUri("https:/no-host");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSchemeWithoutPort() {
    fromUri("gopher://example.com/");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidPort() {
    Authority.of("example.com", 0);
  }
}

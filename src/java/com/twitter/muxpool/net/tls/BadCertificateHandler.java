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

import java.security.cert.X509Certificate;

/**
 * Decides whether to proceed with a server certificate that failed standard validation.
 */
public interface BadCertificateHandler {

  /**
   * @param certificate the server's leaf certificate
   * @param host the host the connection was dialed to
   * @return {@code true} to accept the certificate anyway
   */
  boolean accept(X509Certificate certificate, String host);
}

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

import com.twitter.muxpool.net.tls.ClientSetting;

/**
 * Establishes new transports on behalf of a {@link ConnectionManager}.  Calls may block; the
 * manager runs them off the caller's thread.
 *
 * @param <T> the transport type produced
 */
public interface TransportEstablisher<T extends MultiplexedTransport> {

  /**
   * Creates a new transport to the authority of {@code request}.
   *
   * @param request the request that triggered the attempt
   * @param setting the settings for this attempt, already customized
   * @return an open transport
   * @throws IOException if the transport could not be established
   */
  T establish(ConnectionRequest request, ClientSetting setting) throws IOException;
}

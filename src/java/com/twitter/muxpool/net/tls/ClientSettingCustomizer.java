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

import java.net.URI;

/**
 * A hook invoked before every connection attempt to adjust trust material, the bad certificate
 * policy, or the proxy for that attempt.
 */
public interface ClientSettingCustomizer {

  /**
   * @param target the request target the connection is being made for
   * @param setting fresh settings for this attempt, to be modified in place
   */
  void customize(URI target, ClientSetting setting);
}

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.relay.port.outbound;

import me.golemcore.relay.domain.model.AgentRequest;
import me.golemcore.relay.domain.model.AgentResponse;

/**
 * Port for the isolated agent sandbox. Given a prompt and an optional session
 * token, returns a result and optionally a new session token. Implementations
 * bound the call with a timeout and report failures as an error response
 * rather than throwing.
 */
public interface AgentRunnerPort {

    AgentResponse run(AgentRequest request);
}

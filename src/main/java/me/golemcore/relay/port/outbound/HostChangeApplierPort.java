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

/**
 * External code-modification agent that applies an approved host change plan.
 */
public interface HostChangeApplierPort {

    /**
     * Apply a plan synchronously.
     *
     * @param groupFolder
     *            folder of the group that proposed the plan
     * @param planContent
     *            full plan text
     * @return output of the applier
     * @throws HostChangeApplyException
     *             if the applier fails or exceeds its timeout
     */
    String apply(String groupFolder, String planContent);
}

package me.golemcore.calradia.adapter.outbound.world;

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

import me.golemcore.calradia.port.outbound.WorldStatePort;
import org.springframework.stereotype.Component;

/**
 * World state for the standalone simulation, which never pauses or changes
 * mode. A host embedding the engine supplies its own {@link WorldStatePort}.
 */
@Component
public class AlwaysReadyWorldState implements WorldStatePort {

    @Override
    public boolean isAcceptingResults() {
        return true;
    }
}

package me.golemcore.calradia.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * An NPC's reply to the player, cleaned of emotion markers.
 */
@Value
@Builder
public class DialogueResponse {

    public static final String EMOTION_NEUTRAL = "Neutral";
    public static final String EMOTION_CONFUSED = "Confused";

    String text;
    @Builder.Default
    String emotion = EMOTION_NEUTRAL;
    @Builder.Default
    DialogueIntent intent = DialogueIntent.NEUTRAL;
    boolean endsConversation;

    /**
     * Fallback reply used when no text could be generated.
     */
    public static DialogueResponse error(String text) {
        return DialogueResponse.builder()
                .text(text)
                .emotion(EMOTION_CONFUSED)
                .build();
    }
}

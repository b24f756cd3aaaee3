/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.confhub.transport;

/**
 * Result of a poll. {@code session} is the member the outcome refers to; for
 * {@link PollOutcome#NEW_SUBCHANNEL} it is the newly created subchannel session.
 *
 * @param outcome the poll outcome
 * @param session the session concerned, null for {@link PollOutcome#TIMEOUT}
 */
public record PollResult(PollOutcome outcome, TransportSession session) {
    public static final PollResult TIMEOUT = new PollResult(PollOutcome.TIMEOUT, null);

    public static PollResult activity(TransportSession session) {
        return new PollResult(PollOutcome.ACTIVITY, session);
    }

    public static PollResult sessionGone(TransportSession session) {
        return new PollResult(PollOutcome.SESSION_GONE, session);
    }

    public static PollResult newSubchannel(TransportSession subchannel) {
        return new PollResult(PollOutcome.NEW_SUBCHANNEL, subchannel);
    }
}

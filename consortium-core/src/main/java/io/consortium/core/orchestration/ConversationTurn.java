package io.consortium.core.orchestration;

import java.util.Objects;

/// One earlier exchange of a multi-turn conversation, replayed ahead of the query.
///
/// @param human what the user asked, not null
/// @param assistant the answer given, not null
public record ConversationTurn(String human, String assistant) {

    public ConversationTurn {
        Objects.requireNonNull(human, "human must not be null");
        Objects.requireNonNull(assistant, "assistant must not be null");
    }
}

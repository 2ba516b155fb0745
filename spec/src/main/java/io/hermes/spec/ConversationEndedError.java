package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * The conversation has been ended and accepts no further activity.
 */
public class ConversationEndedError extends A2AError {

    public ConversationEndedError() {
        this("Conversation has ended");
    }

    public ConversationEndedError(String message) {
        this(message, null);
    }

    public ConversationEndedError(String message, @Nullable Object data) {
        super(A2AErrorCodes.CONVERSATION_ENDED_ERROR_CODE, message, data);
    }
}

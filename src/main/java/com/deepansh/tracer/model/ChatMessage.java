package com.deepansh.tracer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message of a chat-model conversation as reported at chat-model start.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private MessageType type;
    private String content;

    /** Only set for generic messages carrying a free-form speaker role */
    private String role;

    public static ChatMessage human(String content) {
        return new ChatMessage(MessageType.human, content, null);
    }

    public static ChatMessage ai(String content) {
        return new ChatMessage(MessageType.ai, content, null);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageType.system, content, null);
    }

    public static ChatMessage generic(String role, String content) {
        return new ChatMessage(MessageType.generic, content, role);
    }

    /**
     * Lowers the message to the {type, data: {content, role}} shape recorded in run inputs.
     */
    public StoredMessage toStored() {
        return new StoredMessage(type.name(), new StoredMessage.Data(content, role));
    }
}

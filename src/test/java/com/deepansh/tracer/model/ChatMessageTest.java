package com.deepansh.tracer.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMessageTest {

    @Test
    void human_lowersWithoutRole() {
        StoredMessage stored = ChatMessage.human("Avast").toStored();

        assertThat(stored.type()).isEqualTo("human");
        assertThat(stored.data().content()).isEqualTo("Avast");
        assertThat(stored.data().role()).isNull();
    }

    @Test
    void generic_keepsRole() {
        StoredMessage stored = ChatMessage.generic("narrator", "Once upon a time").toStored();

        assertThat(stored.type()).isEqualTo("generic");
        assertThat(stored.data().role()).isEqualTo("narrator");
    }

    @Test
    void storedMessage_serializesAsTypeAndData() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ChatMessage.ai("Aye").toStored());

        assertThat(json).isEqualTo("{\"type\":\"ai\",\"data\":{\"content\":\"Aye\",\"role\":null}}");
    }
}

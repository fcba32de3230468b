package com.uconnect.admissionsBot.repository;

import com.uconnect.admissionsBot.repository.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryChatHistoryRepositoryTest {

    private final InMemoryChatHistoryRepository repository =
            new InMemoryChatHistoryRepository(Duration.ofMinutes(30), 100);

    @Test
    void getHistory_shouldReturnEmptyForUnknownSession() {
        assertThat(repository.getHistory("missing", 10)).isEmpty();
        assertThat(repository.exists("missing")).isFalse();
    }

    @Test
    void getHistory_shouldReturnMostRecentMessagesOldestFirst() {
        repository.append("s1", ChatMessage.ROLE_USER, "pregunta 1");
        repository.append("s1", ChatMessage.ROLE_ASSISTANT, "respuesta 1");
        repository.append("s1", ChatMessage.ROLE_USER, "pregunta 2");

        List<ChatMessage> history = repository.getHistory("s1", 2);

        assertThat(history).extracting(ChatMessage::getContent).containsExactly("respuesta 1", "pregunta 2");
        assertThat(history.get(1).isFromUser()).isTrue();
        assertThat(history.get(0).getTimestamp()).isNotNull();
    }

    @Test
    void append_shouldKeepOnlyTheNewestMessages() {
        for (int i = 0; i < InMemoryChatHistoryRepository.MAX_STORED_MESSAGES + 5; i++) {
            repository.append("s1", ChatMessage.ROLE_USER, "mensaje " + i);
        }

        List<ChatMessage> history = repository.getHistory("s1", 1000);

        assertThat(history).hasSize(InMemoryChatHistoryRepository.MAX_STORED_MESSAGES);
        assertThat(history.get(0).getContent()).isEqualTo("mensaje 5");
    }

    @Test
    void delete_shouldRemoveTranscript() {
        repository.append("s1", ChatMessage.ROLE_USER, "hola");

        repository.delete("s1");

        assertThat(repository.exists("s1")).isFalse();
        assertThat(repository.getHistory("s1", 10)).isEmpty();
    }
}

package com.uconnect.admissionsBot.repository;

import com.uconnect.admissionsBot.repository.model.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Chat history stored in MongoDB: one document per session in the {@value #COLLECTION}
 * collection, with the transcript as an embedded {@code messages} array.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "uconnect.history.store", havingValue = "mongo")
public class MongoChatHistoryRepository implements ChatHistoryProvider {

    static final String COLLECTION = "chats";
    private static final int MAX_STORED_MESSAGES = 100;

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ChatMessage> getHistory(String sessionId, int limit) {
        Document chat = mongoTemplate.findOne(bySession(sessionId), Document.class, COLLECTION);
        if (chat == null || limit <= 0) {
            return List.of();
        }
        List<Document> stored = chat.getList("messages", Document.class, List.of());
        List<ChatMessage> messages = new ArrayList<>();
        for (Document message : stored.subList(Math.max(0, stored.size() - limit), stored.size())) {
            Date timestamp = message.getDate("timestamp");
            messages.add(ChatMessage.builder()
                    .role(message.getString("role"))
                    .content(message.getString("content"))
                    .timestamp(timestamp != null ? timestamp.toInstant() : null)
                    .build());
        }
        return messages;
    }

    @Override
    public void append(String sessionId, String role, String content) {
        Date now = new Date();
        Document message = new Document("role", role)
                .append("content", content)
                .append("timestamp", now);
        Update update = new Update()
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        update.push("messages").slice(-MAX_STORED_MESSAGES).each(message);
        mongoTemplate.upsert(bySession(sessionId), update, COLLECTION);
        log.debug("Message appended - sessionId: {}, role: {}", sessionId, role);
    }

    @Override
    public void delete(String sessionId) {
        mongoTemplate.remove(bySession(sessionId), COLLECTION);
    }

    @Override
    public boolean exists(String sessionId) {
        return mongoTemplate.exists(bySession(sessionId), COLLECTION);
    }

    private static Query bySession(String sessionId) {
        return Query.query(Criteria.where("sessionId").is(sessionId));
    }
}

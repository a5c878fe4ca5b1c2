package com.lexbridge.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Builder(toBuilder = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "conversations")
public class Conversation {
    @Id
    private String id;
    private String clientId;
    private String caseId;
    private ConversationPhase phase;
    private String assistantSessionToken; // opaque, handed back to the assistant on every turn
    private Instant createdAt;
    private Instant updatedAt;
}

package com.openforge.mcpchat.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One persisted history entry.
 *
 * payload is the JSON-serialized ConversationMessage; role is duplicated into
 * its own column for ad-hoc queries. sequence orders entries within a
 * conversation and is assigned by the store on insert.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_messages",
    uniqueConstraints = @UniqueConstraint(name = "uq_conversation_sequence",
            columnNames = {"conversation_id", "sequence_no"}),
    indexes = @Index(name = "idx_chat_messages_conversation", columnList = "conversation_id")
)
public class ChatMessageRecord extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 64)
    private String conversationId;

    @Column(name = "sequence_no", nullable = false)
    private Integer sequence;

    @Column(name = "role", nullable = false, length = 16)
    private String role;

    @Column(name = "payload", nullable = false, columnDefinition = "LONGTEXT")
    private String payload;
}

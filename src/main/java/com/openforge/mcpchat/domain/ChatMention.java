package com.openforge.mcpchat.domain;

import com.openforge.mcpchat.mention.Mention;
import com.openforge.mcpchat.mention.MentionKind;
import jakarta.persistence.*;
import lombok.*;

/**
 * A persisted pin. The unique constraint is the (kind, id, serverId) tuple
 * per conversation, so a duplicate pin can never be stored twice.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_mentions",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_mention",
            columnNames = {"conversation_id", "kind", "mention_id", "server_id"})
)
public class ChatMention extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 64)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private MentionKind kind;

    /** Server id for SERVER pins, tool name for TOOL pins. */
    @Column(name = "mention_id", nullable = false, length = 255)
    private String mentionId;

    @Column(name = "server_id", nullable = false, length = 255)
    private String serverId;

    public static ChatMention of(String conversationId, Mention mention) {
        return ChatMention.builder()
                .conversationId(conversationId)
                .kind(mention.kind())
                .mentionId(mention.id())
                .serverId(mention.serverId())
                .build();
    }

    public Mention toMention() {
        return new Mention(kind, mentionId, serverId);
    }
}

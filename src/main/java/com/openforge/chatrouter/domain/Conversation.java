package com.openforge.chatrouter.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One chat thread of one owner.
 *
 *  history: serialized List<Message> (JSON array) of earlier user and
 *            assistant turns, trimmed to a sliding window.  System prompts
 *            and memory context are rebuilt per request and never stored.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "conversations",
    uniqueConstraints = @UniqueConstraint(name = "uq_conversation_id", columnNames = "conversation_id"),
    indexes = @Index(name = "idx_conversation_owner", columnList = "owner_id")
)
public class Conversation extends BaseEntity {

    @Column(name = "conversation_id", nullable = false, length = 64)
    private String conversationId;

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Column(name = "chat_type", nullable = false, length = 32)
    private String chatType;

    @Column(name = "history", columnDefinition = "LONGTEXT")
    private String history;

    @Builder.Default
    @Column(name = "turn_count", nullable = false)
    private Integer turnCount = 0;
}

package com.syntaxprime.elephant.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = ConversationThread.COLLECTION)
public class ConversationThread {
    public static final String COLLECTION = "conversation_threads";

    @Id
    private String id;
    private String ownerId;
    private String title;
    private String platform;
    private String projectId;
    private ThreadStatus status;
    private long messageCount;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastMessageAt;

    public ConversationThread() {}

    public ConversationThread(String id, String ownerId, String title, String platform, String projectId, Instant createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.title = title;
        this.platform = platform;
        this.projectId = projectId;
        this.status = ThreadStatus.ACTIVE;
        this.messageCount = 0;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.lastMessageAt = createdAt;
    }

    public String getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getTitle() { return title; }
    public String getPlatform() { return platform; }
    public String getProjectId() { return projectId; }
    public ThreadStatus getStatus() { return status; }
    public long getMessageCount() { return messageCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getLastMessageAt() { return lastMessageAt; }

    public void setTitle(String title) { this.title = title; }
    public void setStatus(ThreadStatus status) { this.status = status; }
    public void setMessageCount(long messageCount) { this.messageCount = messageCount; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public void setLastMessageAt(Instant lastMessageAt) { this.lastMessageAt = lastMessageAt; }

    public ConversationThread copy() {
        ConversationThread copy = new ConversationThread(id, ownerId, title, platform, projectId, createdAt);
        copy.status = status;
        copy.messageCount = messageCount;
        copy.updatedAt = updatedAt;
        copy.lastMessageAt = lastMessageAt;
        return copy;
    }
}

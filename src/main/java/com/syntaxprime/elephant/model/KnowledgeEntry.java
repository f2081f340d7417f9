package com.syntaxprime.elephant.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.TextScore;

/**
 * Knowledge corpus entry. Written by the ingestion pipeline; this core only touches
 * {@code accessCount} and {@code lastAccessed}.
 */
@Document(collection = KnowledgeEntry.COLLECTION)
public class KnowledgeEntry {
    public static final String COLLECTION = "knowledge_entries";
    public static final double DEFAULT_RELEVANCE_SCORE = 5.0;

    @Id
    private String id;
    private String sourceId;
    private String projectId;
    private String title;
    private String content;
    private String summary;
    private String contentType;
    private List<String> keyTopics = new ArrayList<>();
    private int wordCount;
    private long accessCount;
    private Double relevanceScore;
    // Set by ingestion once summary, topics and index fields are complete
    private boolean processed;
    private Instant createdAt;
    private Instant lastAccessed;
    @TextScore
    private Float textScore;

    public KnowledgeEntry() {}

    public KnowledgeEntry(String id, String title, String content, String contentType, int wordCount) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.contentType = contentType;
        this.wordCount = wordCount;
        this.createdAt = Instant.now();
    }

    public String getId() { return id; }
    public String getSourceId() { return sourceId; }
    public String getProjectId() { return projectId; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public String getSummary() { return summary; }
    public String getContentType() { return contentType; }
    public List<String> getKeyTopics() { return keyTopics == null ? List.of() : keyTopics; }
    public int getWordCount() { return wordCount; }
    public long getAccessCount() { return accessCount; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastAccessed() { return lastAccessed; }
    public Float getTextScore() { return textScore; }
    public boolean isProcessed() { return processed; }

    /**
     * Stored prior on a 0-10 scale; entries ingested without one count as neutral.
     */
    public double getRelevanceScore() {
        return relevanceScore == null ? DEFAULT_RELEVANCE_SCORE : relevanceScore;
    }

    public void setSourceId(String sourceId) { this.sourceId = sourceId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public void setSummary(String summary) { this.summary = summary; }
    public void setKeyTopics(List<String> keyTopics) { this.keyTopics = keyTopics; }
    public void setAccessCount(long accessCount) { this.accessCount = accessCount; }
    public void setRelevanceScore(Double relevanceScore) { this.relevanceScore = relevanceScore; }
    public void setLastAccessed(Instant lastAccessed) { this.lastAccessed = lastAccessed; }
    public void setTextScore(Float textScore) { this.textScore = textScore; }
    public void setProcessed(boolean processed) { this.processed = processed; }
}

package com.captainsprep.engine.persistence.entity;

import com.captainsprep.engine.model.ContentKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "bank_items", indexes = @Index(name = "idx_bank_items_kind_subject", columnList = "kind, subject"))
public class BankItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private ContentKind kind;

    @Column(name = "subject", length = 64)
    private String subject;

    @Column(name = "item_type", length = 32)
    private String itemType;

    @Column(name = "front_content", nullable = false, columnDefinition = "text")
    private String frontContent;

    @Column(name = "back_content", columnDefinition = "text")
    private String backContent;

    @Column(name = "payload_json", nullable = false, columnDefinition = "text")
    private String payloadJson;

    @Column(name = "approved", nullable = false)
    private boolean approved;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected BankItemEntity() {
    }

    public BankItemEntity(ContentKind kind,
                          String subject,
                          String itemType,
                          String frontContent,
                          String backContent,
                          String payloadJson,
                          boolean approved) {
        this.kind = kind;
        this.subject = subject;
        this.itemType = itemType;
        this.frontContent = frontContent;
        this.backContent = backContent;
        this.payloadJson = payloadJson;
        this.approved = approved;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public Long getId() {
        return id;
    }

    public ContentKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    public String getItemType() {
        return itemType;
    }

    public String getFrontContent() {
        return frontContent;
    }

    public String getBackContent() {
        return backContent;
    }

    public String getPayloadJson() {
        return payloadJson;
    }

    public boolean isApproved() {
        return approved;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}

package com.lumis.invoiceingest.infrastructure.jpa;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "pending_recovery")
public class PendingRecoveryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "url", nullable = false)
    private String url;

    @Column(name = "chat_id")
    private String chatId;

    @Column(name = "reception_date", nullable = false)
    private OffsetDateTime receptionDate;

    @Column(name = "type_document", nullable = false)
    private String typeDocument;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "origin", nullable = false)
    private String origin;

    @Column(name = "ws_id")
    private String wsId;

    public PendingRecoveryEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getChatId() { return chatId; }
    public void setChatId(String chatId) { this.chatId = chatId; }

    public OffsetDateTime getReceptionDate() { return receptionDate; }
    public void setReceptionDate(OffsetDateTime receptionDate) { this.receptionDate = receptionDate; }

    public String getTypeDocument() { return typeDocument; }
    public void setTypeDocument(String typeDocument) { this.typeDocument = typeDocument; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getOrigin() { return origin; }
    public void setOrigin(String origin) { this.origin = origin; }

    public String getWsId() { return wsId; }
    public void setWsId(String wsId) { this.wsId = wsId; }

    @Override
    public String toString() {
        return "PendingRecoveryEntity{" +
                "id=" + id +
                ", url='" + url + '\'' +
                ", chatId='" + chatId + '\'' +
                ", typeDocument='" + typeDocument + '\'' +
                ", origin='" + origin + '\'' +
                '}';
    }
}

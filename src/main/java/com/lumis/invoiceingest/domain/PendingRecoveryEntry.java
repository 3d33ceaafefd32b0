package com.lumis.invoiceingest.domain;

import java.time.OffsetDateTime;

/**
 * A submission that could not be turned into a stored invoice. Entries are only ever appended;
 * a second failed attempt for the same URL produces a second entry.
 */
public class PendingRecoveryEntry {

    private final Long id;
    private final String url;
    private final String chatId;
    private final OffsetDateTime receptionDate;
    private final String typeDocument;
    private final Long userId;
    private final String errorMessage;
    private final String origin;
    private final String wsId;

    public PendingRecoveryEntry(Long id, String url, String chatId, OffsetDateTime receptionDate, String typeDocument,
                                Long userId, String errorMessage, String origin, String wsId) {
        this.id = id;
        this.url = url;
        this.chatId = chatId;
        this.receptionDate = receptionDate;
        this.typeDocument = typeDocument;
        this.userId = userId;
        this.errorMessage = errorMessage;
        this.origin = origin;
        this.wsId = wsId;
    }

    public Long getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public String getChatId() {
        return chatId;
    }

    public OffsetDateTime getReceptionDate() {
        return receptionDate;
    }

    public String getTypeDocument() {
        return typeDocument;
    }

    public Long getUserId() {
        return userId;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getOrigin() {
        return origin;
    }

    public String getWsId() {
        return wsId;
    }
}

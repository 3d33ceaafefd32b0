package com.lumis.invoiceingest.application;

import java.time.OffsetDateTime;

public class SubmitInvoiceCommand {
    public final String url;
    public final Long userId;
    public final String chatId;
    public final String channelId;
    public final String source;
    public final OffsetDateTime receivedAt;

    public SubmitInvoiceCommand(String url, Long userId, String chatId, String channelId, String source,
                                OffsetDateTime receivedAt) {
        this.url = url;
        this.userId = userId;
        this.chatId = chatId;
        this.channelId = channelId != null ? channelId : chatId;
        this.source = source;
        this.receivedAt = receivedAt;
    }
}

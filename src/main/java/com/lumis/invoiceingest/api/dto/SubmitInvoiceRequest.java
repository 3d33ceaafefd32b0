package com.lumis.invoiceingest.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public class SubmitInvoiceRequest {
  @NotBlank @Pattern(regexp = "(?i)^https?://.+", message = "must be an http(s) URL") public String url;
  @NotNull @Positive public Long userId;
  public String chatId;
  public String channelId;
  @NotBlank @Pattern(regexp = "(?i)whatsapp|aplicacion|telegram", message = "must be whatsapp, aplicacion or telegram") public String source;
}

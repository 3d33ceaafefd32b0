package com.lumis.invoiceingest.infrastructure.jpa;

import jakarta.persistence.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "processing_log")
public class ProcessingLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "url", nullable = false)
    private String url;

    @Column(name = "cufe")
    private String cufe;

    @Column(name = "origin")
    private String origin;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "error_type")
    private String errorType;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "scraped_fields_count")
    private Integer scrapedFieldsCount;

    @Column(name = "request_timestamp", nullable = false)
    private OffsetDateTime requestTimestamp;

    @Column(name = "response_timestamp")
    private OffsetDateTime responseTimestamp;

    public ProcessingLogEntity() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getCufe() { return cufe; }
    public void setCufe(String cufe) { this.cufe = cufe; }

    public String getOrigin() { return origin; }
    public void setOrigin(String origin) { this.origin = origin; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Long getExecutionTimeMs() { return executionTimeMs; }
    public void setExecutionTimeMs(Long executionTimeMs) { this.executionTimeMs = executionTimeMs; }

    public Integer getScrapedFieldsCount() { return scrapedFieldsCount; }
    public void setScrapedFieldsCount(Integer scrapedFieldsCount) { this.scrapedFieldsCount = scrapedFieldsCount; }

    public OffsetDateTime getRequestTimestamp() { return requestTimestamp; }
    public void setRequestTimestamp(OffsetDateTime requestTimestamp) { this.requestTimestamp = requestTimestamp; }

    public OffsetDateTime getResponseTimestamp() { return responseTimestamp; }
    public void setResponseTimestamp(OffsetDateTime responseTimestamp) { this.responseTimestamp = responseTimestamp; }
}

package com.lumis.invoiceingest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Fetch fetch = new Fetch();
    private Persistence persistence = new Persistence();
    private Pending pending = new Pending();
    private Submission submission = new Submission();

    public Fetch getFetch(){ return fetch; }
    public Persistence getPersistence(){ return persistence; }
    public Pending getPending(){ return pending; }
    public Submission getSubmission(){ return submission; }

    /**
     * Outbound retrieval of the DGI confirmation page.
     */
    public static class Fetch {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Wall-clock budget for the whole fetch, all redirect hops and the body read included. */
        private Duration deadline = Duration.ofSeconds(30);
        private DataSize maxBodySize = DataSize.ofMegabytes(5);
        private int maxRedirects = 5;
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";
        private String acceptLanguage = "es-ES,es;q=0.8,en;q=0.5";

        public Duration getConnectTimeout(){ return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout){ this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout(){ return readTimeout; }
        public void setReadTimeout(Duration readTimeout){ this.readTimeout = readTimeout; }
        public Duration getDeadline(){ return deadline; }
        public void setDeadline(Duration deadline){ this.deadline = deadline; }
        public DataSize getMaxBodySize(){ return maxBodySize; }
        public void setMaxBodySize(DataSize maxBodySize){ this.maxBodySize = maxBodySize; }
        public int getMaxRedirects(){ return maxRedirects; }
        public void setMaxRedirects(int maxRedirects){ this.maxRedirects = maxRedirects; }
        public String getUserAgent(){ return userAgent; }
        public void setUserAgent(String userAgent){ this.userAgent = userAgent; }
        public String getAcceptLanguage(){ return acceptLanguage; }
        public void setAcceptLanguage(String acceptLanguage){ this.acceptLanguage = acceptLanguage; }
    }

    public static class Persistence {
        private int transactionTimeoutSeconds = 15;

        public int getTransactionTimeoutSeconds(){ return transactionTimeoutSeconds; }
        public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds){ this.transactionTimeoutSeconds = transactionTimeoutSeconds; }
    }

    public static class Pending {
        private String documentType = "QR_INVOICE";
        private String originTag = "INVOICE_INGEST";

        public String getDocumentType(){ return documentType; }
        public void setDocumentType(String documentType){ this.documentType = documentType; }
        public String getOriginTag(){ return originTag; }
        public void setOriginTag(String originTag){ this.originTag = originTag; }
    }

    public static class Submission {
        private String allowedHost = "dgi-fep.mef.gob.pa";

        public String getAllowedHost(){ return allowedHost; }
        public void setAllowedHost(String allowedHost){ this.allowedHost = allowedHost; }
    }
}

package com.catalog.importer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {
    private static final String DEFAULT_EXTENSION = ".csv";

    private Upload upload = new Upload();
    private Batch batch = new Batch();
    private Worker worker = new Worker();
    private Stream stream = new Stream();
    private Webhook webhook = new Webhook();
    private Jobs jobs = new Jobs();

    public Upload getUpload() {
        return upload;
    }

    public void setUpload(Upload upload) {
        this.upload = upload;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public static String normalizeExtension(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_EXTENSION;
        }
        String trimmed = candidate.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    public static class Upload {
        private String dir = Paths.get(System.getProperty("java.io.tmpdir"), "product-importer", "uploads").toString();
        private String allowedExtension = DEFAULT_EXTENSION;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public Path getDirPath() {
            return Paths.get(dir).toAbsolutePath().normalize();
        }

        public String getAllowedExtension() {
            return normalizeExtension(allowedExtension);
        }

        public void setAllowedExtension(String allowedExtension) {
            this.allowedExtension = normalizeExtension(allowedExtension);
        }
    }

    public static class Batch {
        private int chunkSize = 5000;
        private int errorSampleLimit = 100;

        public int getChunkSize() {
            return Math.max(1, chunkSize);
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = Math.max(1, chunkSize);
        }

        public int getErrorSampleLimit() {
            return Math.max(0, errorSampleLimit);
        }

        public void setErrorSampleLimit(int errorSampleLimit) {
            this.errorSampleLimit = Math.max(0, errorSampleLimit);
        }
    }

    public static class Worker {
        private int concurrency = 2;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }

    public static class Stream {
        private long timeoutMs = 600_000L;

        public long getTimeoutMs() {
            return Math.max(1_000L, timeoutMs);
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = Math.max(1_000L, timeoutMs);
        }
    }

    public static class Webhook {
        private int timeoutSeconds = 10;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private int concurrency = 4;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }

    public static class Jobs {
        private int defaultListLimit = 10;
        private int maxListLimit = 100;

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = Math.max(1, defaultListLimit);
        }

        public int getMaxListLimit() {
            return Math.max(getDefaultListLimit(), maxListLimit);
        }

        public void setMaxListLimit(int maxListLimit) {
            this.maxListLimit = Math.max(1, maxListLimit);
        }
    }
}

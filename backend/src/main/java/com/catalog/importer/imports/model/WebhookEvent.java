package com.catalog.importer.imports.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something that can be delivered to a webhook: an event name plus its typed payload.
 */
public sealed interface WebhookEvent {

    String eventName();

    Object data();

    /**
     * Lifecycle events that configured webhooks subscribe to by {@link WebhookEventType}.
     */
    sealed interface Lifecycle extends WebhookEvent {
        WebhookEventType type();

        @Override
        default String eventName() {
            return type().value();
        }
    }

    record ImportStarted(ImportEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.IMPORT_STARTED;
        }
    }

    record ImportCompleted(ImportEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.IMPORT_COMPLETED;
        }
    }

    record ImportFailed(ImportEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.IMPORT_FAILED;
        }
    }

    record ProductCreated(ProductEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.PRODUCT_CREATED;
        }
    }

    record ProductUpdated(ProductEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.PRODUCT_UPDATED;
        }
    }

    record ProductDeleted(ProductEventData data) implements Lifecycle {
        @Override
        public WebhookEventType type() {
            return WebhookEventType.PRODUCT_DELETED;
        }
    }

    /**
     * Manual connectivity check against a single webhook.
     */
    record Ping(long webhookId, String webhookName) implements WebhookEvent {
        @Override
        public String eventName() {
            return "test";
        }

        @Override
        public Object data() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("webhook_id", webhookId);
            data.put("webhook_name", webhookName);
            data.put("message", "This is a test webhook from Product Importer");
            return data;
        }
    }
}

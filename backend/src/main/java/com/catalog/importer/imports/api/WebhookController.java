package com.catalog.importer.imports.api;

import com.catalog.importer.imports.model.WebhookEventType;
import com.catalog.importer.imports.model.WebhookTestResult;
import com.catalog.importer.imports.webhook.WebhookDispatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {
    private final WebhookDispatcher webhookDispatcher;

    public WebhookController(WebhookDispatcher webhookDispatcher) {
        this.webhookDispatcher = webhookDispatcher;
    }

    @GetMapping("/events/types")
    public Map<String, List<Map<String, String>>> eventTypes() {
        List<Map<String, String>> types = new ArrayList<>();
        for (WebhookEventType type : WebhookEventType.values()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("value", type.value());
            entry.put("label", type.label());
            types.add(entry);
        }
        return Map.of("event_types", types);
    }

    @PostMapping("/{webhookId}/test")
    public WebhookTestResult test(@PathVariable long webhookId) {
        return webhookDispatcher.test(webhookId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Webhook not found: " + webhookId));
    }
}

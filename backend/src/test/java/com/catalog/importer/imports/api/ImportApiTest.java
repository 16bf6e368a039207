package com.catalog.importer.imports.api;

import com.catalog.importer.imports.model.ProductEventData;
import com.catalog.importer.imports.persistence.ImportTestRows;
import com.catalog.importer.imports.persistence.WebhookRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ImportApiTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WebhookRepository webhookRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private MockMvc mockMvc;
    private String suffix;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        this.suffix = UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    @AfterEach
    void disableTestWebhooks() {
        jdbc.getJdbcTemplate().update("UPDATE webhooks SET is_enabled = FALSE");
    }

    @Test
    void duplicateSkuScenarioKeepsLastRow() throws Exception {
        String csv = """
            sku,name,price,quantity
            PROD-001-%1$s,Widget,9.99,5
            PROD-002-%1$s,Gadget,19.99,3
            PROD-001-%1$s,"Widget v2",12.99,5
            """.formatted(suffix);

        JsonNode job = awaitTerminal(upload("products.csv", csv));

        assertThat(job.get("status").asText()).isEqualTo("completed");
        assertThat(job.get("total_rows").asInt()).isEqualTo(3);
        assertThat(job.get("processed_rows").asInt()).isEqualTo(3);
        assertThat(job.get("created_count").asInt()).isEqualTo(2);
        assertThat(job.get("updated_count").asInt()).isEqualTo(1);
        assertThat(job.get("error_count").asInt()).isZero();
        assertThat(job.get("progress_percentage").asDouble()).isEqualTo(100.0);
        ProductEventData widget = ImportTestRows.findProduct(jdbc, "PROD-001-" + suffix).orElseThrow();
        assertThat(widget.price()).isEqualByComparingTo("12.99");
        assertThat(widget.name()).isEqualTo("Widget v2");
    }

    @Test
    void reimportingTheSameFileOnlyUpdates() throws Exception {
        StringBuilder csv = new StringBuilder("sku,name,price\n");
        for (int i = 0; i < 60; i++) {
            csv.append("R").append(i).append('-').append(suffix).append(",Item ").append(i).append(",1.00\n");
        }

        JsonNode first = awaitTerminal(upload("catalog.csv", csv.toString()));
        JsonNode second = awaitTerminal(upload("catalog.csv", csv.toString()));

        assertThat(first.get("created_count").asInt()).isEqualTo(60);
        assertThat(second.get("status").asText()).isEqualTo("completed");
        assertThat(second.get("created_count").asInt()).isZero();
        assertThat(second.get("updated_count").asInt()).isEqualTo(second.get("total_rows").asInt());
    }

    @Test
    void oneMalformedPriceInHundredRowsIsARowError() throws Exception {
        StringBuilder csv = new StringBuilder("sku,name,price,quantity\n");
        for (int i = 0; i < 100; i++) {
            String price = i == 41 ? "twelve" : "2.50";
            csv.append("H").append(i).append('-').append(suffix).append(",Item,").append(price).append(",1\n");
        }

        JsonNode job = awaitTerminal(upload("hundred.csv", csv.toString()));

        assertThat(job.get("status").asText()).isEqualTo("completed");
        assertThat(job.get("error_count").asInt()).isEqualTo(1);
        assertThat(job.get("created_count").asInt() + job.get("updated_count").asInt()).isEqualTo(99);
        assertThat(job.get("error_details").get(0).get("row").asInt()).isEqualTo(43);
        assertThat(job.get("error_details").get(0).get("field").asText()).isEqualTo("price");
    }

    @Test
    void missingNameHeaderFailsWithoutProcessingRows() throws Exception {
        JsonNode job = awaitTerminal(upload("no-name.csv", "sku,price\nX-" + suffix + ",1.00\n"));

        assertThat(job.get("status").asText()).isEqualTo("failed");
        assertThat(job.get("processed_rows").asInt()).isZero();
        assertThat(job.get("message").asText()).contains("name");
        assertThat(ImportTestRows.findProduct(jdbc, "X-" + suffix)).isEmpty();
    }

    @Test
    void uploadRespondsImmediatelyWithLinks() throws Exception {
        MockMultipartFile file = csvFile("quick.csv", "sku,name\nQ-" + suffix + ",Quick\n");

        MvcResult result = mockMvc.perform(multipart("/api/imports/upload").file(file))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("pending"))
            .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        String jobId = body.get("job_id").asText();
        assertThat(body.get("status_url").asText()).isEqualTo("/api/imports/" + jobId + "/status");
        assertThat(body.get("stream_url").asText()).isEqualTo("/api/imports/" + jobId + "/stream");
        awaitTerminal(jobId);
    }

    @Test
    void rejectsNonCsvAndEmptyUploads() throws Exception {
        mockMvc.perform(multipart("/api/imports/upload").file(csvFile("products.txt", "sku,name\nA,B\n")))
            .andExpect(status().isBadRequest());
        mockMvc.perform(multipart("/api/imports/upload").file(csvFile("empty.csv", "")))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownJobsAreNotFound() throws Exception {
        mockMvc.perform(get("/api/imports/does-not-exist/status"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/imports/does-not-exist/cancel"))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/imports/does-not-exist"))
            .andExpect(status().isNotFound());
    }

    @Test
    void lateStreamSubscriberGetsTerminalSnapshotOnce() throws Exception {
        String jobId = upload("late.csv", "sku,name\nL-" + suffix + ",Late\n");
        awaitTerminal(jobId);

        MvcResult result = mockMvc.perform(get("/api/imports/" + jobId + "/stream")).andReturn();

        String body = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(body.split("data:", -1)).hasSize(2);
        assertThat(body).contains("\"status\":\"completed\"").contains("\"id\":\"" + jobId + "\"");
    }

    @Test
    void finishedJobsCanBeListedAndDeletedButNotCancelled() throws Exception {
        String jobId = upload("done.csv", "sku,name\nD-" + suffix + ",Done\n");
        awaitTerminal(jobId);

        mockMvc.perform(get("/api/imports").param("limit", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items").isArray())
            .andExpect(jsonPath("$.total").isNumber());
        mockMvc.perform(post("/api/imports/" + jobId + "/cancel"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("import_job_conflict"));
        mockMvc.perform(delete("/api/imports/" + jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").exists());
        mockMvc.perform(get("/api/imports/" + jobId + "/status"))
            .andExpect(status().isNotFound());
    }

    @Test
    void lifecycleWebhooksFireOnlyForEnabledSubscriptions() throws Exception {
        MockWebServer enabledServer = new MockWebServer();
        MockWebServer disabledServer = new MockWebServer();
        for (int i = 0; i < 5; i++) {
            enabledServer.enqueue(new MockResponse().setResponseCode(200));
        }
        enabledServer.start();
        disabledServer.start();
        try {
            long hookId = ImportTestRows.insertWebhook(jdbc, 
                "enabled-" + suffix, enabledServer.url("/done").toString(), "import.completed", "topsecret", true
            );
            ImportTestRows.insertWebhook(jdbc, 
                "disabled-" + suffix, disabledServer.url("/done").toString(), "import.completed", null, false
            );

            String jobId = upload("hooks.csv", "sku,name\nW-" + suffix + ",Hooked\n");
            awaitTerminal(jobId);

            RecordedRequest request = takeRequestFor(enabledServer, jobId);
            assertThat(request).isNotNull();
            assertThat(request.getHeader("X-Webhook-Event")).isEqualTo("import.completed");
            assertThat(request.getHeader("X-Webhook-Signature")).startsWith("sha256=");
            assertThat(disabledServer.getRequestCount()).isZero();

            awaitRecordedDelivery(hookId);
            assertThat(webhookRepository.findById(hookId).orElseThrow().lastResponseCode()).isEqualTo(200);
        } finally {
            enabledServer.shutdown();
            disabledServer.shutdown();
        }
    }

    @Test
    void webhookEventTypesAreListed() throws Exception {
        mockMvc.perform(get("/api/webhooks/events/types"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.event_types.length()").value(6))
            .andExpect(jsonPath("$.event_types[0].value").value("product.created"))
            .andExpect(jsonPath("$.event_types[0].label").value("Product Created"));
    }

    @Test
    void manualWebhookTestReportsOutcome() throws Exception {
        MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(201));
        server.start();
        try {
            long hookId = ImportTestRows.insertWebhook(jdbc, 
                "manual-" + suffix, server.url("/ping").toString(), "product.updated", null, false
            );

            mockMvc.perform(post("/api/webhooks/" + hookId + "/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status_code").value(201))
                .andExpect(jsonPath("$.response_time_ms").isNumber());
            assertThat(server.getRequestCount()).isEqualTo(1);
        } finally {
            server.shutdown();
        }
        mockMvc.perform(post("/api/webhooks/987654321/test"))
            .andExpect(status().isNotFound());
    }

    private String upload(String filename, String content) throws Exception {
        MvcResult result = mockMvc.perform(multipart("/api/imports/upload").file(csvFile(filename, content)))
            .andExpect(status().isAccepted())
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("job_id").asText();
    }

    private JsonNode awaitTerminal(String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 15_000;
        while (true) {
            String content = mockMvc.perform(get("/api/imports/" + jobId + "/status"))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
            JsonNode job = objectMapper.readTree(content);
            String state = job.get("status").asText();
            if ("completed".equals(state) || "failed".equals(state)) {
                return job;
            }
            assertThat(System.currentTimeMillis()).as("import %s did not finish", jobId).isLessThan(deadline);
            Thread.sleep(25);
        }
    }

    // deliveries for imports finished by earlier tests may still arrive first
    private static RecordedRequest takeRequestFor(MockWebServer server, String jobId) throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
            if (request == null || request.getBody().clone().readUtf8().contains(jobId)) {
                return request;
            }
        }
        return null;
    }

    private void awaitRecordedDelivery(long hookId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (webhookRepository.findById(hookId).orElseThrow().lastTriggeredAt() == null) {
            assertThat(System.currentTimeMillis()).isLessThan(deadline);
            Thread.sleep(25);
        }
    }

    private static MockMultipartFile csvFile(String filename, String content) {
        return new MockMultipartFile("file", filename, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }
}

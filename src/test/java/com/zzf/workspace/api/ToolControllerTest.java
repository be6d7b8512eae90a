package com.zzf.workspace.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.metrics.AutoConfigureMetrics;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "workspace.filesystem-root=target/test-workspace/fs",
        "workspace.sandbox-root=target/test-workspace/sandbox",
        "workspace.embedding.provider=hashing"
})
@AutoConfigureMetrics
public class ToolControllerTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    public void testHealthEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/actuator/health"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("\"status\""));
    }

    @Test
    public void testPrometheusEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/actuator/prometheus"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("# TYPE"));
    }

    @Test
    public void testListTools() throws Exception {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/api/tools"), String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());

        List<String> names = new ArrayList<>();
        for (JsonNode spec : objectMapper.readTree(resp.getBody())) {
            names.add(spec.get("name").asText());
        }
        assertTrue(names.contains("read_file"));
        assertTrue(names.contains("workspace_search"));
        assertTrue(names.contains("workspace_index_content"));
    }

    @Test
    public void testIndexContentThenSearch() {
        ObjectNode index = request("op-http-search");
        index.putObject("args")
                .put("path", "notes/http.md")
                .put("content", "The retry budget for outbound calls is three attempts.");
        JsonNode indexed = call("workspace_index_content", index);
        assertEquals("ok", indexed.get("status").asText());
        assertEquals("/notes/http.md", indexed.get("result").get("path").asText());

        ObjectNode search = request("op-http-search");
        search.putObject("args").put("query", "retry budget").put("mode", "bm25");
        JsonNode found = call("workspace_search", search);
        assertEquals("ok", found.get("status").asText());
        JsonNode results = found.get("result").get("results");
        assertTrue(results.size() >= 1);
        assertEquals("/notes/http.md", results.get(0).get("path").asText());
    }

    @Test
    public void testWriteWithoutApprovalIsRefused() {
        ObjectNode write = request("op-http-write");
        write.putObject("args").put("path", "/blocked.txt").put("content", "x");

        JsonNode result = call("write_file", write);

        assertEquals("error", result.get("status").asText());
        assertEquals("approval_required", result.get("error").asText());
        assertTrue(result.get("recoverable").asBoolean());
    }

    @Test
    public void testTraceIdIsEchoed() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Trace-Id", "trace-from-client");
        ObjectNode body = request("op-trace");
        body.putObject("args").put("query", "");

        ResponseEntity<JsonNode> resp = restTemplate.postForEntity(
                url("/api/tools/workspace_search"), new HttpEntity<>(body, headers), JsonNode.class);

        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertEquals("trace-from-client", resp.getHeaders().getFirst("X-Trace-Id"));
        assertEquals("trace-from-client", resp.getBody().get("traceId").asText());
        assertEquals("invalid_arguments", resp.getBody().get("error").asText());
        assertFalse(resp.getBody().has("result"));
    }

    @Test
    public void testMalformedBodyIsRejected() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> resp = restTemplate.postForEntity(
                url("/api/tools/read_file"), new HttpEntity<>("{not json", headers), JsonNode.class);

        assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
        assertEquals("invalid_arguments", resp.getBody().get("error").asText());
    }

    private ObjectNode request(String operationId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("operationId", operationId);
        return body;
    }

    private JsonNode call(String tool, ObjectNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<JsonNode> resp = restTemplate.postForEntity(
                url("/api/tools/" + tool), new HttpEntity<>(body, headers), JsonNode.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        return resp.getBody();
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}

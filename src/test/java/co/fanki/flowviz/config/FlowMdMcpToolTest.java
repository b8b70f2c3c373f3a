package co.fanki.flowviz.config;

import co.fanki.flowviz.flowmd.application.FlowGraphService;
import co.fanki.flowviz.flowmd.domain.FlowMdParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for the FlowMD MCP tools.
 *
 * <p>Talks to the MCP server through the stdio transport over
 * in-process pipes: initialize handshake, tool listing and tool calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowMdMcpToolTest {

    private static final String CHECKOUT =
            "graph LR\\nA[Cart]-->B[Payment]\\nB-->C[Receipt]\\nB-->A";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private McpSyncServer server;
    private PrintWriter clientWriter;
    private BufferedReader clientReader;
    private PipedOutputStream clientToServer;

    @BeforeEach
    void setUp() throws Exception {
        clientToServer = new PipedOutputStream();
        final PipedInputStream serverIn =
                new PipedInputStream(clientToServer);
        final PipedOutputStream serverOut = new PipedOutputStream();
        final PipedInputStream serverToClient =
                new PipedInputStream(serverOut);

        final StdioServerTransportProvider transport =
                new StdioServerTransportProvider(
                        objectMapper, serverIn, serverOut);

        server = new McpStdioServerConfiguration().mcpSyncServer(
                transport, new FlowGraphService(new FlowMdParser()),
                objectMapper);

        clientWriter = new PrintWriter(
                new OutputStreamWriter(clientToServer));
        clientReader = new BufferedReader(
                new InputStreamReader(serverToClient));

        performHandshake();
    }

    @AfterEach
    void tearDown() {
        try {
            clientToServer.close();
        } catch (final Exception ignored) {}
        if (server != null) {
            server.close();
        }
    }

    @Test
    void whenListingTools_shouldRegisterAllFlowMdTools() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode tools = readJson().path("result").path("tools");
        assertTrue(tools.isArray());

        final Set<String> names = new HashSet<>();
        for (final JsonNode tool : tools) {
            names.add(tool.path("name").asText());
            assertEquals("string", tool.path("inputSchema")
                    .path("properties").path("text").path("type").asText());
        }
        assertEquals(Set.of("parse_flowmd", "downstream", "search_node"),
                names);
    }

    @Test
    void whenCallingParse_givenValidText_shouldReturnGraphJson()
            throws Exception {
        callTool(20, "parse_flowmd", "{\"text\":\"" + CHECKOUT + "\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode graph = objectMapper.readTree(
                result.path("content").get(0).path("text").asText());
        assertEquals(3, graph.path("nodes").size());
        assertEquals("LR", graph.path("meta").path("orientation").asText());
        assertEquals("Cycle detected: A -> B -> A", graph.path("meta")
                .path("warnings").get(0).path("message").asText());
    }

    @Test
    void whenCallingParse_givenLimitArgument_shouldReturnError()
            throws Exception {
        callTool(21, "parse_flowmd",
                "{\"text\":\"" + CHECKOUT + "\",\"maxNodes\":2}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean());
        assertTrue(result.path("content").get(0).path("text").asText()
                .contains("exceeds hard limit 2"));
    }

    @Test
    void whenCallingDownstream_givenStartNode_shouldReturnReachableSet()
            throws Exception {
        callTool(22, "downstream",
                "{\"text\":\"" + CHECKOUT + "\",\"startId\":\"C\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode downstream = objectMapper.readTree(
                result.path("content").get(0).path("text").asText());
        assertEquals(1, downstream.path("nodes").size());
        assertEquals("C", downstream.path("nodes").get(0).asText());
        assertEquals(0, downstream.path("edges").size());
    }

    @Test
    void whenCallingSearch_givenLabelFragment_shouldReturnNode()
            throws Exception {
        callTool(23, "search_node",
                "{\"text\":\"" + CHECKOUT + "\",\"query\":\"Pay\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        assertTrue(result.path("content").get(0).path("text").asText()
                .contains("\"id\":\"B\""));
    }

    @Test
    void whenCallingSearch_givenNoMatch_shouldReturnError()
            throws Exception {
        callTool(24, "search_node",
                "{\"text\":\"" + CHECKOUT + "\",\"query\":\"Refund\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean());
        assertEquals("No node matches: Refund", result.path("content")
                .get(0).path("text").asText());
    }

    private void callTool(final int id, final String name,
            final String arguments) {
        send("{\"jsonrpc\":\"2.0\",\"id\":" + id
                + ",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"" + name + "\","
                + "\"arguments\":" + arguments + "}}");
    }

    private void performHandshake() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-client\","
                + "\"version\":\"1.0\"}}}");

        readJson();

        send("{\"jsonrpc\":\"2.0\","
                + "\"method\":\"notifications/initialized\","
                + "\"params\":{}}");

        Thread.sleep(50);
    }

    private void send(final String json) {
        clientWriter.println(json);
        clientWriter.flush();
    }

    private JsonNode readJson() throws Exception {
        final CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return clientReader.readLine();
                    } catch (final Exception e) {
                        throw new RuntimeException(e);
                    }
                });
        final String line = future.get(5, TimeUnit.SECONDS);
        assertNotNull(line, "Server did not respond within 5 seconds");
        return objectMapper.readTree(line);
    }
}

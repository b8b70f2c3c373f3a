package co.fanki.flowviz.config;

import co.fanki.flowviz.flowmd.application.FlowGraphService;
import co.fanki.flowviz.flowmd.domain.FlowGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Exposes the FlowMD operations as MCP tools over stdio.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * the web server is disabled (see
 * {@link HeadlessModeEnvironmentPostProcessor}) and an MCP server
 * communicates via stdin/stdout using the JSON-RPC protocol.
 * Every tool takes the FlowMD text itself, so a client needs no prior
 * call to hold a graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String PARSE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "The FlowMD source, starting with graph or flowchart"
                },
                "maxNodes": {
                  "type": "integer",
                  "description": "Hard node limit (defaults to the server setting)"
                },
                "preferredMaxNodes": {
                  "type": "integer",
                  "description": "Advisory node limit (defaults to the server setting)"
                }
              },
              "required": ["text"]
            }
            """;

    private static final String DOWNSTREAM_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "The FlowMD source"
                },
                "startId": {
                  "type": "string",
                  "description": "The node id to start from"
                }
              },
              "required": ["text", "startId"]
            }
            """;

    private static final String SEARCH_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "text": {
                  "type": "string",
                  "description": "The FlowMD source"
                },
                "query": {
                  "type": "string",
                  "description": "Exact node id or a fragment of its label"
                }
              },
              "required": ["text", "query"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param flowGraphService the service that handles all tool operations
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final FlowGraphService flowGraphService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("flowviz-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        server.addTool(parseTool(flowGraphService, objectMapper));
        server.addTool(downstreamTool(flowGraphService, objectMapper));
        server.addTool(searchTool(flowGraphService, objectMapper));

        LOG.info("MCP stdio server initialized with 3 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification parseTool(
            final FlowGraphService flowGraphService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("parse_flowmd",
                        "Parse a FlowMD flowchart into nodes, edges,"
                                + " subgraph groups and warnings"
                                + " (unrecognised lines, cycles).",
                        PARSE_SCHEMA),
                (exchange, arguments) -> {
                    final String text = (String) arguments.get("text");
                    final Integer maxNodes =
                            arguments.get("maxNodes") instanceof Number n
                                    ? n.intValue() : null;
                    final Integer preferredMaxNodes =
                            arguments.get("preferredMaxNodes")
                                    instanceof Number p
                                    ? p.intValue() : null;

                    try {
                        final FlowGraph graph = flowGraphService.parse(
                                text, maxNodes, preferredMaxNodes);
                        return toCallToolResult(objectMapper, graph);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification downstreamTool(
            final FlowGraphService flowGraphService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("downstream",
                        "List the nodes and edges reachable from a node"
                                + " of a FlowMD flowchart. Ids and edge"
                                + " keys come back sorted.",
                        DOWNSTREAM_SCHEMA),
                (exchange, arguments) -> {
                    final String text = (String) arguments.get("text");
                    final String startId =
                            (String) arguments.get("startId");

                    try {
                        final FlowGraph graph = flowGraphService.parse(text);
                        return toCallToolResult(objectMapper,
                                flowGraphService.downstream(graph, startId));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification searchTool(
            final FlowGraphService flowGraphService,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("search_node",
                        "Find the first node of a FlowMD flowchart whose"
                                + " id equals, or whose label contains,"
                                + " the query.",
                        SEARCH_SCHEMA),
                (exchange, arguments) -> {
                    final String text = (String) arguments.get("text");
                    final String query = (String) arguments.get("query");

                    try {
                        final FlowGraph graph = flowGraphService.parse(text);
                        return flowGraphService.search(graph, query)
                                .map(node -> toCallToolResult(
                                        objectMapper, node))
                                .orElseGet(() -> new CallToolResult(
                                        List.of(new McpSchema.TextContent(
                                                "No node matches: "
                                                        + query)),
                                        true));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error: {}", e.getMessage());
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}

package co.fanki.flowviz.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the FlowViz Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FlowViz Server API")
                        .description("""
                                FlowViz Server - parses FlowMD flowcharts for the browser viewer.

                                ## Features
                                - **Parse**: FlowMD text to nodes, edges, subgraph groups and warnings
                                - **Cycle detection**: cycles reported as warnings
                                - **Downstream highlight**: nodes and edges reachable from a node
                                - **Search** and **CSV export** of the parsed graph

                                ## MCP Tools
                                - `parse_flowmd` - Parse FlowMD text
                                - `downstream` - Downstream subgraph of a node
                                - `search_node` - Find a node by id or label
                                """)
                        .version("0.0.1")
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")));
    }

}

package co.fanki.flowviz;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * FlowViz Server Application.
 *
 * <p>Serves the FlowMD viewer and its JSON API. Started with
 * {@code --selftest} it runs the bundled fixture suite instead, writes
 * the report and exits without opening a port; with
 * {@code mcp.server.stdio=true} it speaks MCP on stdin/stdout. In both
 * modes the web server is switched off by
 * {@link co.fanki.flowviz.config.HeadlessModeEnvironmentPostProcessor}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FlowVizServerApplication {

    /** Command line flag that switches to self-test mode. */
    static final String SELFTEST_FLAG = "--selftest";

    /** Property the flag turns into, read by the self-test runner. */
    static final String SELFTEST_PROPERTY = "--flowviz.selftest.enabled=true";

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        run(args);
    }

    /**
     * Starts the application.
     *
     * <p>The self-test flag is passed on as a command line property so it
     * outranks the {@code application.yml} default.</p>
     *
     * @param args command line arguments
     * @return the running context
     */
    static ConfigurableApplicationContext run(final String... args) {
        final List<String> arguments = new ArrayList<>(Arrays.asList(args));
        if (arguments.contains(SELFTEST_FLAG)) {
            arguments.add(SELFTEST_PROPERTY);
        }
        return SpringApplication.run(FlowVizServerApplication.class,
                arguments.toArray(new String[0]));
    }

}

package co.fanki.flowviz.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Announces the viewer URL once the web server has bound its port.
 *
 * <p>The default port is 0, so the actual port is only known here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class ViewerUrlLogger {

    private static final Logger LOG = LoggerFactory.getLogger(
            ViewerUrlLogger.class);

    /**
     * Logs the viewer URL.
     *
     * @param event the server initialized event
     */
    @EventListener
    public void onWebServerInitialized(final WebServerInitializedEvent event) {
        LOG.info("FlowViz server started on http://127.0.0.1:{}/viewer.html",
                event.getWebServer().getPort());
    }

}

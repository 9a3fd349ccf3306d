package com.chatpulse.client;

import com.chatpulse.config.ChatPulseProperties;
import com.chatpulse.exception.ChatPulseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Opens the connection once the application is ready, when {@code chatpulse.connect-on-startup}
 * is set. A failed first connect is logged; the application stays up and can connect later.
 */
@Component
public class StartupConnectRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupConnectRunner.class);

    private final ClientRuntime clientRuntime;
    private final ChatPulseProperties properties;

    public StartupConnectRunner(ClientRuntime clientRuntime, ChatPulseProperties properties) {
        this.clientRuntime = clientRuntime;
        this.properties = properties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!properties.isConnectOnStartup()) {
            log.info("Startup connect disabled, waiting for an explicit connect()");
            return;
        }
        log.info("Startup: connecting to {}", properties.getTransport().getUrl());
        try {
            clientRuntime.connect().whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Startup connect failed: {}", error.getMessage());
                } else {
                    log.info("Startup connect succeeded, authentication in progress");
                }
            });
        } catch (ChatPulseException e) {
            log.error("Startup connect rejected: {}", e.getMessage());
        }
    }
}

package org.datayoinker.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class StartupLogger {

    private final String datasourceUrl;

    public StartupLogger(@Value("${spring.datasource.url:}") String datasourceUrl) {
        this.datasourceUrl = datasourceUrl;
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("server starting at port {} (storage: {})", event.getWebServer().getPort(), datasourceUrl);
    }
}

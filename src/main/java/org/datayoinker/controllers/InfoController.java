package org.datayoinker.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class InfoController {

    private final ObjectProvider<BuildProperties> buildProperties;

    @GetMapping(value = "/info", produces = MediaType.TEXT_PLAIN_VALUE)
    public String info() {
        BuildProperties build = buildProperties.getIfAvailable();
        String version = build != null ? build.getVersion() : "(devel)";
        String buildTime = build != null && build.getTime() != null ? build.getTime().toString() : "unknown";
        return "Version information about datayoinker:"
                + "\n\tVersion: " + version
                + "\n\tBuildTime: " + buildTime
                + "\n";
    }
}

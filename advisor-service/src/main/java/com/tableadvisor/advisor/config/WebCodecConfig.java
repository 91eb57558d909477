package com.tableadvisor.advisor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Raises the in-memory body limit so full-screen captures fit into a single frame upload.
 * WebFlux buffers at most 256 KB by default.
 */
@Configuration
public class WebCodecConfig implements WebFluxConfigurer {

    private final DataSize maxFrameSize;

    public WebCodecConfig(@Value("${advisor.frames.max-in-memory-size:16MB}") DataSize maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        configurer.defaultCodecs().maxInMemorySize((int) maxFrameSize.toBytes());
    }

    public DataSize maxFrameSize() {
        return maxFrameSize;
    }
}

package com.sdmarker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sdmarker.domain.marker.model.MarkerSet;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerGroups;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerSet;
import com.sdmarker.infrastructure.marker.compile.PatternCompiler;
import com.sdmarker.infrastructure.marker.loader.MarkerConfigReader;
import com.sdmarker.infrastructure.marker.loader.MarkerSetLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads and compiles the marker taxonomy once at startup. An invalid configuration fails
 * context startup with MarkerConfigException or PatternCompileException.
 */
@Slf4j
@Configuration
public class MarkerEngineConfig {

    @Value("${markers.config-location:classpath:markers/enhanced_sd_markers.yaml}")
    private String configLocation;

    @Bean
    public MarkerSet markerSet(MarkerConfigReader reader, MarkerSetLoader loader) {
        return loader.load(reader.read(configLocation));
    }

    @Bean
    public CompiledMarkerSet compiledMarkerSet(PatternCompiler compiler, MarkerSet markerSet) {
        return compiler.compile(markerSet);
    }

    @Bean
    public CompiledMarkerGroups compiledMarkerGroups(PatternCompiler compiler, MarkerSet markerSet) {
        return compiler.compileGroups(markerSet);
    }

    // Boot only auto-configures an ObjectMapper when spring-web is on the classpath
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService markerScanExecutor(@Value("${markers.parallelism:4}") int parallelism) {
        int threads = Math.max(1, parallelism);
        log.info("[MarkerEngineConfig] Marker scan pool with {} threads", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "marker-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}

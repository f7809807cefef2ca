package io.skywatch.bus.spring;

import io.skywatch.bus.StreamBus;
import io.skywatch.bus.StreamTransport;
import io.skywatch.bus.transport.InMemoryStreamTransport;
import io.skywatch.bus.transport.LettuceStreamTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Opens the shared {@link StreamBus} handle. A bus that cannot be reached after the configured
 * attempts fails context startup.
 */
@AutoConfiguration
@EnableConfigurationProperties(StreamBusProperties.class)
@ConditionalOnProperty(prefix = "skywatch.bus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamBusAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StreamBusAutoConfiguration.class);

    // closed by the owning StreamBus
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    StreamTransport streamTransport(StreamBusProperties properties) {
        if (properties.getMode() == StreamBusProperties.Mode.MEMORY) {
            log.warn("Using in-memory stream bus; commands and status stay inside this process");
            return new InMemoryStreamTransport();
        }
        return new LettuceStreamTransport(properties.toConnectionSettings());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    StreamBus streamBus(StreamTransport transport, StreamBusProperties properties) {
        StreamBus bus = new StreamBus(transport, properties.toBusSettings());
        bus.open().orElseThrow();
        log.info("Stream bus ready (mode={}, host={}, port={})",
            properties.getMode(), properties.getHost(), properties.getPort());
        return bus;
    }
}

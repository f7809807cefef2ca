package io.skywatch.executor.config;

import io.skywatch.executor.hardware.simulation.SimulatedCorrelator;
import io.skywatch.executor.hardware.simulation.SimulatedNetworkAnalyzer;
import io.skywatch.executor.hardware.simulation.SimulatedSensorArray;
import io.skywatch.executor.hardware.simulation.SimulatedSwitchNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Simulated devices used when no driver package provides the capability beans.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "skywatch.executor.simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedHardwareConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SimulatedHardwareConfiguration.class);

    @Bean
    SimulatedSwitchNetwork switchNetwork(ExecutorProperties properties) {
        log.warn("Using simulated hardware (latency={}ms)", properties.getSimulation().getLatency().toMillis());
        return new SimulatedSwitchNetwork(properties.getSimulation().getLatency());
    }

    @Bean
    SimulatedNetworkAnalyzer networkAnalyzer(ExecutorProperties properties) {
        return new SimulatedNetworkAnalyzer(properties.getSimulation().getLatency());
    }

    @Bean
    SimulatedSensorArray sensorArray(ExecutorProperties properties) {
        return new SimulatedSensorArray(properties.getSensors().getIds(), properties.getSimulation().getLatency());
    }

    @Bean
    SimulatedCorrelator correlator(ExecutorProperties properties) {
        return new SimulatedCorrelator(properties.getSimulation().getLatency());
    }
}

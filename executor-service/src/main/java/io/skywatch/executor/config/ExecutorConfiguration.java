package io.skywatch.executor.config;

import io.skywatch.bus.ExponentialBackoff;
import io.skywatch.bus.Sleeper;
import io.skywatch.bus.StreamBus;
import io.skywatch.checkpoint.CheckpointStore;
import io.skywatch.checkpoint.JsonFileCheckpointStore;
import io.skywatch.executor.hardware.Correlator;
import io.skywatch.executor.hardware.NetworkAnalyzer;
import io.skywatch.executor.hardware.SensorArray;
import io.skywatch.executor.hardware.SwitchNetwork;
import io.skywatch.executor.loop.CommandDispatcher;
import io.skywatch.executor.loop.CommandExecutor;
import io.skywatch.executor.loop.DataPublisher;
import io.skywatch.executor.loop.ExecutorCheckpoint;
import io.skywatch.executor.loop.ExecutorLifecycle;
import io.skywatch.executor.loop.HeartbeatEmitter;
import io.skywatch.executor.loop.SensorSampler;
import io.skywatch.protocol.ProtocolCodec;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class ExecutorConfiguration {

    @Bean
    Clock executorClock() {
        return Clock.systemUTC();
    }

    @Bean
    ProtocolCodec protocolCodec() {
        return ProtocolCodec.withDefaults();
    }

    @Bean
    CheckpointStore<ExecutorCheckpoint> executorCheckpointStore(ExecutorProperties properties) {
        return new JsonFileCheckpointStore<>(ProtocolCodec.defaultObjectMapper(), properties.getCheckpointFile(),
            ExecutorCheckpoint.class);
    }

    @Bean
    DataPublisher dataPublisher(StreamBus bus, ProtocolCodec codec) {
        return new DataPublisher(bus, codec);
    }

    @Bean
    CommandDispatcher commandDispatcher(SwitchNetwork switchNetwork,
                                        NetworkAnalyzer networkAnalyzer,
                                        SensorArray sensorArray,
                                        Correlator correlator,
                                        DataPublisher dataPublisher,
                                        ExecutorProperties properties,
                                        Clock executorClock) {
        return new CommandDispatcher(switchNetwork, networkAnalyzer, sensorArray, correlator, dataPublisher,
            properties.getHardwareTimeout(), executorClock);
    }

    @Bean
    SensorSampler sensorSampler(CommandDispatcher dispatcher, ExecutorProperties properties, Clock executorClock) {
        return new SensorSampler(dispatcher, properties.getSensors().getIds(),
            properties.getSensors().getSampleInterval(), executorClock);
    }

    @Bean
    CommandExecutor commandExecutor(StreamBus bus,
                                    ProtocolCodec codec,
                                    CommandDispatcher dispatcher,
                                    SensorSampler sampler,
                                    CheckpointStore<ExecutorCheckpoint> executorCheckpointStore,
                                    ExecutorProperties properties,
                                    Clock executorClock) {
        ExecutorProperties.Loop loop = properties.getLoop();
        CommandExecutor.Settings settings = new CommandExecutor.Settings(
            properties.getTarget(),
            loop.getBlockTimeout(),
            loop.getReadCount(),
            new ExponentialBackoff(loop.getBackoffInitial(), loop.getBackoffMax(), 2.0),
            properties.getStatusHistory());
        return new CommandExecutor(bus, codec, dispatcher, sampler, executorCheckpointStore, settings,
            Sleeper.SYSTEM, executorClock);
    }

    @Bean
    HeartbeatEmitter heartbeatEmitter(StreamBus bus, ExecutorProperties properties) {
        return new HeartbeatEmitter(bus, properties.getTarget(), properties.getHeartbeat().getTtl(),
            properties.getHeartbeat().getInterval());
    }

    @Bean
    ExecutorLifecycle executorLifecycle(ExecutorProperties properties,
                                        CommandExecutor executor,
                                        HeartbeatEmitter heartbeat,
                                        CommandDispatcher dispatcher,
                                        DataPublisher dataPublisher,
                                        Clock executorClock) {
        return new ExecutorLifecycle(properties.getTarget(), executor, heartbeat, dispatcher, dataPublisher, executorClock);
    }
}

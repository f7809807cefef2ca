package io.skywatch.executor;

import static org.assertj.core.api.Assertions.assertThat;

import io.skywatch.bus.StreamBus;
import io.skywatch.executor.loop.ExecutorLifecycle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
    "skywatch.bus.mode=memory",
    "skywatch.executor.target=testrig",
    "skywatch.executor.checkpoint-file=target/test-state/executor-app-checkpoint.json",
    "skywatch.executor.simulation.latency=0ms",
    "skywatch.executor.loop.block-timeout=100ms"
})
class ExecutorApplicationTest {

    @Autowired
    StreamBus bus;

    @Autowired
    ExecutorLifecycle lifecycle;

    @Test
    void startsAndAdvertisesCapabilities() {
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(bus.getValue("capabilities:testrig").orElseThrow())
            .hasValueSatisfying(json -> assertThat(json)
                .contains("\"switch\"")
                .contains("\"therm\""));
    }
}

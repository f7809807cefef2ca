package io.skywatch.executor.hardware;

import java.util.concurrent.CompletableFuture;

public interface SwitchNetwork {

    CompletableFuture<HardwareOutcome> applySwitchState(SwitchPath path);
}

package me.golemcore.agent.testsupport.tools;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolSource;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Configurable in-memory tool for scheduler, registry and turn tests.
 */
public final class StubTool implements ToolComponent {

    private final String name;
    private final ToolSource source;
    private final String serverName;
    private final Function<Map<String, Object>, CompletableFuture<Optional<ConfirmationRequest>>> confirmation;
    private final Function<Map<String, Object>, CompletableFuture<ToolResult>> execution;
    private final AtomicInteger executions = new AtomicInteger();

    private StubTool(String name, ToolSource source, String serverName,
            Function<Map<String, Object>, CompletableFuture<Optional<ConfirmationRequest>>> confirmation,
            Function<Map<String, Object>, CompletableFuture<ToolResult>> execution) {
        this.name = name;
        this.source = source;
        this.serverName = serverName;
        this.confirmation = confirmation;
        this.execution = execution;
    }

    public static StubTool returning(String name, String output) {
        return executing(name, args -> CompletableFuture.completedFuture(ToolResult.success(output)));
    }

    public static StubTool executing(String name, Function<Map<String, Object>, CompletableFuture<ToolResult>> execution) {
        return new StubTool(name, ToolSource.BUILTIN, null,
                args -> CompletableFuture.completedFuture(Optional.empty()), execution);
    }

    public static StubTool throwing(String name, RuntimeException failure) {
        return executing(name, args -> {
            throw failure;
        });
    }

    public static StubTool confirming(String name, ConfirmationRequest request, String output) {
        return new StubTool(name, ToolSource.BUILTIN, null,
                args -> CompletableFuture.completedFuture(Optional.of(request)),
                args -> CompletableFuture.completedFuture(ToolResult.success(output)));
    }

    public StubTool withSource(ToolSource newSource, String newServerName) {
        return new StubTool(name, newSource, newServerName, confirmation, execution);
    }

    public int getExecutions() {
        return executions.get();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple(name, "Stub tool " + name);
    }

    @Override
    public ToolSource getSource() {
        return source;
    }

    @Override
    public String getServerName() {
        return serverName;
    }

    @Override
    public CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        return confirmation.apply(parameters);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        executions.incrementAndGet();
        return execution.apply(parameters);
    }
}

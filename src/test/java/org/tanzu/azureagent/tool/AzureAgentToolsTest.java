package org.tanzu.azureagent.tool;

import org.junit.jupiter.api.Test;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.tanzu.azureagent.intent.IntentHandler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AzureAgentToolsTest {

    private final IntentHandler intentHandler = mock(IntentHandler.class);
    private final AzureAgentTools tools = new AzureAgentTools(intentHandler);

    @Test
    void queryAzureDelegatesToIntentHandler() {
        when(intentHandler.processQuery("show all vms")).thenReturn("No Virtual Machines found in the current subscription.");

        assertEquals("No Virtual Machines found in the current subscription.", tools.queryAzure("show all vms"));
    }

    @Test
    void queryAzureReturnsUnexpectedFailuresAsText() {
        when(intentHandler.processQuery("show key vaults")).thenThrow(new IllegalStateException("boom"));

        assertEquals("Unexpected error: boom", tools.queryAzure("show key vaults"));
    }

    @Test
    void exposesSingleQueryTool() {
        ToolCallback[] callbacks = ToolCallbacks.from(tools);

        assertEquals(1, callbacks.length);
        assertEquals("queryAzure", callbacks[0].getToolDefinition().name());
        assertTrue(callbacks[0].getToolDefinition().inputSchema().contains("query"));
    }
}

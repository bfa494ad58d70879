package me.golemcore.taskcore.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.ConversationTurn;
import me.golemcore.taskcore.domain.model.LlmRequest;
import me.golemcore.taskcore.domain.model.LlmResponse;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String TEST_MODEL = "test-model";
    private static final String WEATHER = "plugin_weather";

    private TaskCoreProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new TaskCoreProperties();
        properties.getLlm().getLangchain4j().setModel(TEST_MODEL);
        adapter = new Langchain4jAdapter(properties, new ObjectMapper()) {
            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                // No-op for fast retry tests.
            }
        };
    }

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals(TEST_MODEL, adapter.getCurrentModel());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        properties.getLlm().getLangchain4j().setApiKey("  ");
        assertFalse(adapter.isAvailable());

        properties.getLlm().getLangchain4j().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void chatShouldFailWithoutApiKey() {
        LlmRequest request = LlmRequest.builder().turns(List.of(ConversationTurn.user("hi"))).build();

        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void shouldConvertEveryTurnRole() {
        ConversationTurn.ToolCall call = ConversationTurn.ToolCall.builder()
                .id("call-1")
                .name(WEATHER)
                .arguments(Map.of("action", "current"))
                .build();
        LlmRequest request = LlmRequest.builder()
                .turns(List.of(
                        ConversationTurn.system("Be brief."),
                        ConversationTurn.user("Weather?"),
                        ConversationTurn.builder().role(ConversationTurn.ROLE_ASSISTANT).toolCalls(List.of(call))
                                .build(),
                        ConversationTurn.toolResult(call, "sunny"),
                        ConversationTurn.builder().role(ConversationTurn.ROLE_ASSISTANT).content("It is sunny.")
                                .build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("Be brief.", ((SystemMessage) messages.get(0)).text());
        assertEquals("Weather?", ((UserMessage) messages.get(1)).singleText());
        AiMessage toolRequest = (AiMessage) messages.get(2);
        assertTrue(toolRequest.hasToolExecutionRequests());
        assertEquals("{\"action\":\"current\"}", toolRequest.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call-1", result.id());
        assertEquals(WEATHER, result.toolName());
        assertEquals("sunny", result.text());
        assertEquals("It is sunny.", ((AiMessage) messages.get(4)).text());
    }

    @Test
    void shouldConvertCapabilitySchema() {
        CapabilityDefinition definition = CapabilityDefinition.builder()
                .name(WEATHER)
                .description("Weather: forecasts")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "action", Map.of("type", "string", "enum", List.of("current", "forecast")),
                                "city", Map.of("type", "string", "description", "City name")),
                        "required", List.of("action")))
                .build();

        ToolSpecification spec = adapter.convertToolDefinition(definition);

        assertEquals(WEATHER, spec.name());
        assertEquals("Weather: forecasts", spec.description());
        JsonObjectSchema parameters = spec.parameters();
        assertEquals(List.of("action"), parameters.required());
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("action"));
        assertEquals(List.of("current", "forecast"),
                ((JsonEnumSchema) parameters.properties().get("action")).enumValues());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("city"));
    }

    @Test
    void shouldConvertToolCallsInResponse() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call-9")
                        .name(WEATHER)
                        .arguments("{\"action\":\"forecast\",\"arguments\":{\"days\":3}}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build();

        LlmResponse converted = adapter.convertResponse(response);

        assertTrue(converted.hasToolCalls());
        ConversationTurn.ToolCall call = converted.getToolCalls().get(0);
        assertEquals("call-9", call.getId());
        assertEquals("forecast", call.getArguments().get("action"));
        assertEquals(Map.of("days", 3), call.getArguments().get("arguments"));
        assertEquals("TOOL_EXECUTION", converted.getFinishReason());
        assertEquals(TEST_MODEL, converted.getModel());
    }

    @Test
    void shouldSendToolsAndReplyLimit() throws Exception {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenReturn(textResponse("Hello"));
        installModel(model);

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .turns(List.of(ConversationTurn.user("hi")))
                .tools(List.of(CapabilityDefinition.simple("current_datetime", "Current time")))
                .maxTokens(128)
                .build()).get();

        assertEquals("Hello", response.getContent());
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(captor.capture());
        assertEquals(1, captor.getValue().toolSpecifications().size());
        assertEquals(128, captor.getValue().maxOutputTokens());
    }

    @Test
    void shouldRetryOnRateLimit() throws Exception {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class)))
                .thenThrow(new RuntimeException("429 Too Many Requests"))
                .thenReturn(textResponse("after retry"));
        installModel(model);

        LlmResponse response = adapter.chat(userRequest()).get();

        assertEquals("after retry", response.getContent());
        verify(model, times(2)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldNotRetryOtherErrors() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("invalid api key"));
        installModel(model);

        assertThrows(ExecutionException.class, () -> adapter.chat(userRequest()).get());
        verify(model, times(1)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate_limit exceeded"));
        installModel(model);

        assertThrows(ExecutionException.class, () -> adapter.chat(userRequest()).get());
        verify(model, times(4)).chat(any(ChatRequest.class));
    }

    private void installModel(ChatModel model) {
        ReflectionTestUtils.setField(adapter, "chatModel", model);
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }

    private static LlmRequest userRequest() {
        return LlmRequest.builder().turns(List.of(ConversationTurn.user("hi"))).build();
    }

    private static ChatResponse textResponse(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .finishReason(FinishReason.STOP)
                .build();
    }
}

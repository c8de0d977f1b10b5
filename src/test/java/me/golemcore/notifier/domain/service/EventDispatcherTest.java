package me.golemcore.notifier.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.notifier.domain.model.EventType;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.domain.render.EventRenderer;
import me.golemcore.notifier.domain.render.IssuesRenderer;
import me.golemcore.notifier.domain.render.MalformedPayloadException;
import me.golemcore.notifier.domain.render.PingRenderer;
import me.golemcore.notifier.domain.render.PullRequestRenderer;
import me.golemcore.notifier.domain.render.PushRenderer;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EventDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private IssuesRenderer issuesRenderer;
    private PingRenderer pingRenderer;
    private PullRequestRenderer pullRequestRenderer;
    private PushRenderer pushRenderer;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        issuesRenderer = mock(IssuesRenderer.class);
        pingRenderer = mock(PingRenderer.class);
        pullRequestRenderer = mock(PullRequestRenderer.class);
        pushRenderer = mock(PushRenderer.class);
        when(issuesRenderer.getEventType()).thenReturn(EventType.ISSUES);
        when(pingRenderer.getEventType()).thenReturn(EventType.PING);
        when(pullRequestRenderer.getEventType()).thenReturn(EventType.PULL_REQUEST);
        when(pushRenderer.getEventType()).thenReturn(EventType.PUSH);

        NotifierProperties properties = new NotifierProperties();
        properties.getRender().setMaxLineLength(20);
        dispatcher = new EventDispatcher(List.of(issuesRenderer, pingRenderer, pullRequestRenderer, pushRenderer),
                properties);
    }

    // ==================== Registration ====================

    @Test
    void shouldRejectTwoRenderersForSameType() {
        PushRenderer another = mock(PushRenderer.class);
        when(another.getEventType()).thenReturn(EventType.PUSH);
        List<EventRenderer> renderers = List.of(pushRenderer, another);
        NotifierProperties properties = new NotifierProperties();

        assertThrows(IllegalStateException.class, () -> new EventDispatcher(renderers, properties));
    }

    @Test
    void shouldReportTypeWithoutRendererAsUnsupported() {
        EventDispatcher pushOnly = new EventDispatcher(List.of(pushRenderer), new NotifierProperties());

        RenderResult result = pushOnly.dispatch(EventType.ISSUES, mapper.createObjectNode());

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
        verifyNoInteractions(issuesRenderer);
    }

    // ==================== Dispatch ====================

    @Test
    void shouldRouteEachTypeToItsRenderer() {
        JsonNode payload = mapper.createObjectNode();
        when(issuesRenderer.render(payload)).thenReturn(RenderResult.lines("issue"));
        when(pingRenderer.render(payload)).thenReturn(RenderResult.lines("ping"));
        when(pullRequestRenderer.render(payload)).thenReturn(RenderResult.lines("pr"));
        when(pushRenderer.render(payload)).thenReturn(RenderResult.lines("push"));

        assertEquals(List.of("issue"), dispatcher.dispatch(EventType.ISSUES, payload).getLines());
        assertEquals(List.of("ping"), dispatcher.dispatch(EventType.PING, payload).getLines());
        assertEquals(List.of("pr"), dispatcher.dispatch(EventType.PULL_REQUEST, payload).getLines());
        assertEquals(List.of("push"), dispatcher.dispatch(EventType.PUSH, payload).getLines());
    }

    @Test
    void shouldReportUnknownTypeAsUnsupported() {
        RenderResult result = dispatcher.dispatch(EventType.UNKNOWN, mapper.createObjectNode());

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
        verifyNoInteractions(issuesRenderer, pingRenderer, pullRequestRenderer, pushRenderer);
    }

    @Test
    void shouldTurnMalformedPayloadIntoUnsupported() {
        JsonNode payload = mapper.createObjectNode();
        when(pushRenderer.render(payload)).thenThrow(new MalformedPayloadException("ref", "is missing"));

        RenderResult result = dispatcher.dispatch(EventType.PUSH, payload);

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
    }

    @Test
    void shouldPassSkipThrough() {
        JsonNode payload = mapper.createObjectNode();
        when(issuesRenderer.render(payload)).thenReturn(RenderResult.skipped("issue action 'labeled'"));

        RenderResult result = dispatcher.dispatch(EventType.ISSUES, payload);

        assertEquals(RenderResult.Kind.SKIPPED, result.getKind());
    }

    @Test
    void shouldSanitizeRenderedLines() {
        JsonNode payload = mapper.createObjectNode();
        when(pushRenderer.render(payload))
                .thenReturn(RenderResult.lines(List.of("first\nsecond", "a line that is far too long")));

        RenderResult result = dispatcher.dispatch(EventType.PUSH, payload);

        assertEquals(List.of("first second", "a line that is fa..."), result.getLines());
    }

    @Test
    void shouldDropPushWithMissingFieldsUsingRealRenderer() {
        PushRenderer realPush = new PushRenderer(new NotifierProperties());
        EventDispatcher realDispatcher = new EventDispatcher(List.of(new IssuesRenderer(), pingRenderer,
                new PullRequestRenderer(), realPush), new NotifierProperties());
        ObjectNode payload = mapper.createObjectNode();
        payload.put("ref", "refs/heads/main");

        RenderResult result = realDispatcher.dispatch(EventType.PUSH, payload);

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
        assertTrue(result.getReason().contains("sender.login"));
    }
}

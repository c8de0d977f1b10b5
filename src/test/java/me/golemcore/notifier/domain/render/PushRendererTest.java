package me.golemcore.notifier.domain.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.notifier.domain.model.RenderResult;
import me.golemcore.notifier.infrastructure.config.NotifierProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushRendererTest {

    private static final String B = String.valueOf(IrcFormatting.BOLD);
    private static final String FORCED = "\u000304\u0002force-pushed\u000F";
    private static final String COMPARE = "https://github.com/acme/widgets/compare/abc...def";

    private final ObjectMapper mapper = new ObjectMapper();
    private PushRenderer renderer;

    @BeforeEach
    void setUp() {
        NotifierProperties properties = new NotifierProperties();
        properties.getRender().setMaxCommitsPerEvent(3);
        renderer = new PushRenderer(properties);
    }

    // ==================== Branches ====================

    @Test
    void shouldRenderSummaryAndCommitsWhenWithinLimit() {
        RenderResult result = renderer.render(push("refs/heads/main", false, false, 3));

        assertTrue(result.hasLines());
        assertEquals(List.of(
                B + "alice" + B + " has pushed 3 commits to acme/widgets/main: " + COMPARE,
                "Alice Author 0000000 Commit number 0",
                "Alice Author 1111111 Commit number 1",
                "Alice Author 2222222 Commit number 2"), result.getLines());
    }

    @Test
    void shouldRenderOnlySummaryWhenOverLimit() {
        RenderResult result = renderer.render(push("refs/heads/main", false, false, 4));

        assertEquals(List.of(B + "alice" + B + " has pushed 4 commits to acme/widgets/main: " + COMPARE),
                result.getLines());
    }

    @Test
    void shouldUseSingularForOneCommit() {
        RenderResult result = renderer.render(push("refs/heads/dev", false, false, 1));

        assertEquals(B + "alice" + B + " has pushed 1 commit to acme/widgets/dev: " + COMPARE,
                result.getLines().get(0));
        assertEquals(2, result.getLines().size());
    }

    @Test
    void shouldRenderPushWithoutCommits() {
        RenderResult result = renderer.render(push("refs/heads/main", false, false, 0));

        assertEquals(List.of(B + "alice" + B + " has pushed to acme/widgets/main"), result.getLines());
    }

    @Test
    void shouldMarkForcePush() {
        RenderResult result = renderer.render(push("refs/heads/main", false, true, 2));

        assertEquals(B + "alice" + B + " has " + FORCED + " 2 commits to acme/widgets/main: " + COMPARE,
                result.getLines().get(0));
    }

    @Test
    void shouldRenderIdenticallyTwice() {
        ObjectNode plain = push("refs/heads/main", false, false, 2);
        ObjectNode forced = push("refs/heads/main", false, true, 3);
        String plainBefore = plain.toString();

        assertEquals(renderer.render(plain).getLines(), renderer.render(plain).getLines());
        assertEquals(renderer.render(forced).getLines(), renderer.render(forced).getLines());
        assertEquals(plainBefore, plain.toString());
    }

    @Test
    void shouldKeepOnlyFirstLineOfCommitMessage() {
        ObjectNode payload = push("refs/heads/main", false, false, 0);
        ArrayNode commits = (ArrayNode) payload.get("commits");
        commits.add(commit("Bob Builder", "abcdef0123456789", "Fix the build\n\nLong explanation here"));

        RenderResult result = renderer.render(payload);

        assertEquals("Bob Builder abcdef0 Fix the build", result.getLines().get(1));
    }

    @Test
    void shouldHonorConfiguredCommitLimit() {
        NotifierProperties properties = new NotifierProperties();
        properties.getRender().setMaxCommitsPerEvent(0);
        PushRenderer strict = new PushRenderer(properties);

        RenderResult result = strict.render(push("refs/heads/main", false, false, 1));

        assertEquals(1, result.getLines().size());
    }

    // ==================== Deletes & tags ====================

    @Test
    void shouldRenderBranchDeletion() {
        RenderResult result = renderer.render(push("refs/heads/feature", true, false, 0));

        assertEquals(List.of(B + "alice" + B + " has deleted acme/widgets/feature"), result.getLines());
    }

    @Test
    void shouldRenderTagDeletion() {
        RenderResult result = renderer.render(push("refs/tags/v1.0", true, false, 0));

        assertEquals(List.of(B + "alice" + B + " has deleted acme/widgets/v1.0"), result.getLines());
    }

    @Test
    void shouldRenderTagPush() {
        RenderResult result = renderer.render(push("refs/tags/v1.2.0", false, false, 0));

        assertEquals(List.of(B + "alice" + B + " has pushed tag v1.2.0 to acme/widgets: "
                + "https://github.com/acme/widgets/releases/tag/v1.2.0"), result.getLines());
    }

    @Test
    void shouldRenderForcedTagPush() {
        RenderResult result = renderer.render(push("refs/tags/v2", false, true, 0));

        assertTrue(result.getLines().get(0).contains(" has " + FORCED + " tag v2 to acme/widgets: "));
    }

    @Test
    void shouldSkipNightlyTag() {
        RenderResult result = renderer.render(push("refs/tags/last-successful", false, true, 0));

        assertEquals(RenderResult.Kind.SKIPPED, result.getKind());
    }

    // ==================== Odd refs ====================

    @Test
    void shouldReportUnsupportedForUnparsableRef() {
        RenderResult result = renderer.render(push("refs/heads/feature/login", false, false, 1));

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
        assertTrue(result.getReason().contains("refs/heads/feature/login"));
    }

    @Test
    void shouldReportUnsupportedForOtherRefTypes() {
        RenderResult result = renderer.render(push("refs/notes/commits", false, false, 0));

        assertEquals(RenderResult.Kind.UNSUPPORTED, result.getKind());
    }

    @Test
    void shouldRenderDeletionOfUnparsableRefWithRepositoryOnly() {
        RenderResult result = renderer.render(push("weird", true, false, 0));

        assertEquals(List.of(B + "alice" + B + " has deleted acme/widgets"), result.getLines());
    }

    @Test
    void shouldFailOnMissingField() {
        ObjectNode payload = push("refs/heads/main", false, false, 1);
        payload.remove("compare");

        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> renderer.render(payload));
        assertEquals("compare", e.getPath());
    }

    @Test
    void shouldFailOnWrongFieldType() {
        ObjectNode payload = push("refs/heads/main", false, false, 0);
        payload.put("forced", "yes");

        assertThrows(MalformedPayloadException.class, () -> renderer.render(payload));
    }

    @Test
    void shouldShortenShaAndCutMessage() {
        assertEquals("abcdef0", PushRenderer.shortSha("abcdef0123"));
        assertEquals("abc", PushRenderer.shortSha("abc"));
        assertEquals("one", PushRenderer.firstLine("one\ntwo"));
        assertEquals("single", PushRenderer.firstLine("single"));
    }

    private ObjectNode push(String ref, boolean deleted, boolean forced, int commitCount) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("ref", ref);
        payload.put("deleted", deleted);
        payload.put("forced", forced);
        payload.put("compare", COMPARE);
        payload.putObject("sender").put("login", "alice");
        ObjectNode repository = payload.putObject("repository");
        repository.put("full_name", "acme/widgets");
        repository.put("html_url", "https://github.com/acme/widgets");
        ArrayNode commits = payload.putArray("commits");
        for (int i = 0; i < commitCount; i++) {
            commits.add(commit("Alice Author", String.valueOf(i).repeat(40), "Commit number " + i));
        }
        return payload;
    }

    private ObjectNode commit(String author, String id, String message) {
        ObjectNode commit = mapper.createObjectNode();
        commit.put("id", id);
        commit.put("message", message);
        commit.putObject("author").put("name", author);
        return commit;
    }
}

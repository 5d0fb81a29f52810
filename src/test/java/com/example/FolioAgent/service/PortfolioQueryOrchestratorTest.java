package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.HybridRetrievalResult;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.KbDocument;
import com.example.FolioAgent.model.PortfolioAnswer;
import com.example.FolioAgent.model.QueryOptions;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.ResponderInput;
import com.example.FolioAgent.model.ResponseStrategy;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.ScoredDocument;
import com.example.FolioAgent.model.SearchMethod;
import com.example.FolioAgent.model.SourceCategory;
import com.example.FolioAgent.model.SourceRef;
import com.example.FolioAgent.model.ThinkingEvent;
import com.example.FolioAgent.repository.KbDocumentLexicalRepository;
import com.example.FolioAgent.repository.KbDocumentVectorRepository;
import com.example.FolioAgent.service.responder.EducationResponder;
import com.example.FolioAgent.service.responder.PortfolioResponder;
import com.example.FolioAgent.service.responder.ResponderRouter;
import com.example.FolioAgent.tools.ToolRegistry;
import com.example.FolioAgent.tools.WebGuideToolDefinition;
import com.example.FolioAgent.tools.WebGuideToolFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PortfolioQueryOrchestratorTest {

    private static final String GOOD_ANSWER =
            "Yuqi studied Computer Science and earned a Bachelor of Science degree at Stony Brook University [docId=1].";

    private AgentProperties properties;
    private ChatClient chatClient;
    private ChatClientResolver chatClientResolver;
    private HybridRetrievalService retrievalService;
    private ResponderRouter responderRouter;
    private PortfolioResponder responder;
    private QueryLogService queryLogService;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        chatClientResolver = mock(ChatClientResolver.class);
        when(chatClientResolver.resolve(any())).thenReturn(chatClient);
        retrievalService = mock(HybridRetrievalService.class);
        responderRouter = mock(ResponderRouter.class);
        responder = mock(PortfolioResponder.class);
        when(responderRouter.route(any())).thenReturn(responder);
        queryLogService = mock(QueryLogService.class);
        meterRegistry = new SimpleMeterRegistry();
    }

    private PortfolioQueryOrchestrator orchestrator(HybridRetrievalService retrieval) {
        MetricsRecorder metrics = new MetricsRecorder(meterRegistry);
        StageExecutor stageExecutor = new StageExecutor(metrics);
        EventEmitter eventEmitter = new EventEmitter();
        ToolRegistry toolRegistry = new ToolRegistry(
                List.of(new WebGuideToolDefinition()),
                Map.of(WebGuideToolDefinition.NAME, new WebGuideToolFunction()));
        return new PortfolioQueryOrchestrator(
                new IntentClassifier(chatClientResolver, properties),
                new ContextEnricher(retrieval, eventEmitter, properties),
                new ToolDispatcher(toolRegistry, stageExecutor, eventEmitter, properties),
                responderRouter,
                new ResponseValidator(properties),
                eventEmitter,
                stageExecutor,
                metrics,
                queryLogService,
                properties);
    }

    private PortfolioQueryOrchestrator orchestrator() {
        return orchestrator(retrievalService);
    }

    private static RetrievalResult hit(long id, String docType, String content, double score) {
        return new RetrievalResult(new KbDocument(id, docType, content), score,
                SearchMethod.SEMANTIC, Set.of(SearchMethod.SEMANTIC), score);
    }

    private static HybridRetrievalResult educationHits() {
        return new HybridRetrievalResult(List.of(
                hit(1L, "education", "B.S. in Computer Science, Stony Brook University, 2017-2021.", 0.91),
                hit(2L, "education", "Relevant coursework: Algorithms, Operating Systems, Databases.", 0.84)
        ), false, Set.of());
    }

    private void answerWith(String text) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(text);
    }

    @Test
    void educationQuestionIsAnsweredFromEducationChunks() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responderRouter.route(Intent.EDUCATION))
                .thenReturn(new EducationResponder(chatClientResolver, new ObjectMapper()));
        answerWith(GOOD_ANSWER);

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        assertThat(answer.intent()).isEqualTo(Intent.EDUCATION);
        verify(retrievalService).retrieve("What degree did you study?", 12, Set.of(SourceCategory.EDUCATION));
        assertThat(answer.response()).isEqualTo(GOOD_ANSWER);
        assertThat(answer.sources()).extracting(SourceRef::id).containsExactly(1L);
        assertThat(answer.sources()).allSatisfy(s -> assertThat(s.type()).isEqualTo("education"));
        assertThat((Map<String, Object>) answer.metadata().get("validation")).containsEntry("state", "PASSED");
    }

    @Test
    void emptyCorpusStillProducesAnAnswerWithoutSources() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(HybridRetrievalResult.empty());
        when(responderRouter.route(Intent.EDUCATION))
                .thenReturn(new EducationResponder(chatClientResolver, new ObjectMapper()));

        PortfolioAnswer answer = orchestrator().handleQuery("Which university did Yuqi attend?", QueryOptions.defaults());

        assertThat(answer.sources()).isEmpty();
        assertThat(answer.response()).isNotBlank().isNotEqualTo(properties.getValidation().getFallbackResponse());
        assertThat((Map<String, Object>) answer.metadata().get("validation")).containsEntry("state", "PASSED");
        assertThat(answer.metadata().get("retryCount")).isEqualTo(0);
    }

    @Test
    void semanticOutageFallsBackToLexicalAndMarksDegraded() {
        EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
        when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("embedding service down"));
        KbDocumentVectorRepository vectorRepository = mock(KbDocumentVectorRepository.class);
        KbDocumentLexicalRepository lexicalRepository = mock(KbDocumentLexicalRepository.class);
        when(lexicalRepository.search(any(), any(), anyInt())).thenReturn(List.of(
                new ScoredDocument(new KbDocument(7L, "projects", "FolioAgent: a portfolio Q&A agent."), 0.4)));
        HybridRetrievalService hybrid =
                new HybridRetrievalService(embeddingModel, vectorRepository, lexicalRepository, properties);

        when(responder.respond(any())).thenReturn(DraftResponse.of(
                "FolioAgent is a question answering agent that Yuqi built for this portfolio site [docId=7].",
                ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator(hybrid).handleQuery("What projects has Yuqi built?", QueryOptions.defaults());

        assertThat(answer.intent()).isEqualTo(Intent.PERSONAL_PROJECT);
        assertThat(answer.response()).contains("FolioAgent");
        assertThat(answer.sources()).extracting(SourceRef::id).containsExactly(7L);
        assertThat(answer.metadata()).containsEntry("degraded", true);
        assertThat(answer.metadata().get("degradedMethods")).isEqualTo(List.of("SEMANTIC"));
    }

    @Test
    void shortDraftIsRetriedOnceWithWiderContext() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(
                DraftResponse.of("Too short.", ResponseStrategy.PRIMARY),
                DraftResponse.of("Yuqi holds a Bachelor of Science in Computer Science from Stony Brook [docId=1].",
                        ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        verify(retrievalService).retrieve(anyString(), eq(12), any());
        verify(retrievalService).retrieve(anyString(), eq(24), any());
        assertThat(answer.metadata().get("retryCount")).isEqualTo(1);
        assertThat((Map<String, Object>) answer.metadata().get("validation")).containsEntry("state", "PASSED");
        assertThat(answer.response()).startsWith("Yuqi holds");
    }

    @Test
    void unsafeDraftFailsSafeWithoutRetrying() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(DraftResponse.of(
                "Sure, here is the key I use for the site: sk-abcdefghijklmnopqrstuvwxyz012345, enjoy it.",
                ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        verify(responder, times(1)).respond(any());
        assertThat(answer.response()).isEqualTo(properties.getValidation().getFallbackResponse());
        assertThat(answer.sources()).isEmpty();
        assertThat(answer.metadata().get("retryCount")).isEqualTo(0);
        assertThat((Map<String, Object>) answer.metadata().get("validation"))
                .containsEntry("state", "FAILED_SAFE")
                .containsEntry("check", "safety");
    }

    @Test
    void retriesStopAtTheCap() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(DraftResponse.of("Nope.", ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        verify(responder, times(3)).respond(any());
        assertThat(answer.metadata().get("retryCount")).isEqualTo(2);
        assertThat(answer.response()).isEqualTo(properties.getValidation().getFallbackResponse());
    }

    @Test
    void generationFailureSwitchesToAlternateStrategy() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any()))
                .thenThrow(new IllegalStateException("model overloaded"))
                .thenReturn(DraftResponse.of(
                        "Yuqi completed a Bachelor of Science in Computer Science at Stony Brook [docId=1].",
                        ResponseStrategy.ALTERNATE));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        ArgumentCaptor<ResponderInput> inputs = ArgumentCaptor.forClass(ResponderInput.class);
        verify(responder, times(2)).respond(inputs.capture());
        assertThat(inputs.getAllValues()).extracting(ResponderInput::strategy)
                .containsExactly(ResponseStrategy.PRIMARY, ResponseStrategy.ALTERNATE);
        verify(retrievalService, times(1)).retrieve(anyString(), anyInt(), any());
        assertThat((Map<String, Object>) answer.metadata().get("validation")).containsEntry("state", "PASSED");
    }

    @Test
    void forcedIntentSkipsClassification() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(HybridRetrievalResult.empty());
        when(responder.respond(any())).thenReturn(DraftResponse.of(
                "Yuqi is proficient in Java, Spring Boot, PostgreSQL and React, used across several projects.",
                ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?",
                new QueryOptions(false, Intent.SKILLS, "s-1", "openai"));

        assertThat(answer.intent()).isEqualTo(Intent.SKILLS);
        assertThat((Map<String, Object>) answer.metadata().get("classification")).containsEntry("source", "forced");
        assertThat(answer.metadata()).containsEntry("sessionId", "s-1").containsEntry("model", "openai");
    }

    @Test
    void slowClassifierFallsBackToDefaultIntent() {
        properties.getTimeouts().setClassify(Duration.ofMillis(100));
        when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return "SKILLS";
        });
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(HybridRetrievalResult.empty());
        when(responder.respond(any())).thenReturn(DraftResponse.of(
                "Hi! I'm the assistant on this portfolio site and can tell you about Yuqi's background.",
                ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("Hello there, who runs this place?", QueryOptions.defaults());

        assertThat(answer.intent()).isEqualTo(Intent.GENERAL);
        assertThat((Map<String, Object>) answer.metadata().get("classification"))
                .containsEntry("source", "default")
                .containsKey("note");
    }

    @Test
    void failingResponderEndsInFallbackAnswer() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responderRouter.route(any())).thenThrow(new IllegalStateException("boom"));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        assertThat(answer.response()).isEqualTo(properties.getValidation().getFallbackResponse());
        assertThat(answer.intent()).isEqualTo(Intent.EDUCATION);
    }

    @Test
    void cancelledRequestEndsFailedSafe() {
        PortfolioQueryOrchestrator orchestrator = orchestrator();
        RequestState state = orchestrator.newState("What degree did you study?", QueryOptions.defaults());
        state.cancel();

        PortfolioAnswer answer = orchestrator.run(state);

        assertThat((Map<String, Object>) answer.metadata().get("validation"))
                .containsEntry("state", "FAILED_SAFE")
                .containsEntry("reason", "cancelled");
        assertThat(answer.sources()).isEmpty();
        verify(responder, never()).respond(any());
    }

    @Test
    void retrievalThatOutlivesItsTimeoutLeavesNoTraceInTheAnswer() {
        properties.getTimeouts().setRetrieve(Duration.ofMillis(100));
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenAnswer(inv -> {
            long until = System.nanoTime() + Duration.ofMillis(400).toNanos();
            while (System.nanoTime() < until) {
                // busy wait, deaf to interrupts
            }
            return educationHits();
        });
        when(responder.respond(any())).thenAnswer(inv -> {
            Thread.sleep(800);
            return DraftResponse.of(
                    "I could not reach the knowledge base, but Yuqi's education details are listed on the site.",
                    ResponseStrategy.PRIMARY);
        });

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?",
                QueryOptions.defaults().withStream(true));

        ArgumentCaptor<ResponderInput> input = ArgumentCaptor.forClass(ResponderInput.class);
        verify(responder).respond(input.capture());
        assertThat(input.getValue().context().isEmpty()).isTrue();
        assertThat(answer.sources()).isEmpty();
        assertThat(answer.metadata()).containsEntry("degraded", true).doesNotContainKey("retrieval");
        assertThat((List<?>) answer.metadata().get("events"))
                .extracting(e -> ((ThinkingEvent) e).type())
                .doesNotContain("retrieval");
    }

    @Test
    void projectTourUsesTheWebGuideTool() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(HybridRetrievalResult.empty());
        when(responder.respond(any())).thenReturn(DraftResponse.of(
                "Start at the Home page, then continue to About, Experience, Projects and Case Studies.",
                ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("Can you give me a tour of the site?", QueryOptions.defaults());

        ArgumentCaptor<ResponderInput> input = ArgumentCaptor.forClass(ResponderInput.class);
        verify(responder).respond(input.capture());
        assertThat(answer.intent()).isEqualTo(Intent.PROJECT_TOUR);
        assertThat(input.getValue().tool()).isNotNull();
        assertThat(input.getValue().tool().succeeded()).isTrue();
        assertThat((List<?>) answer.metadata().get("tools")).hasSize(1);
    }

    @Test
    void nonStreamingRequestsRecordNoEvents() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(DraftResponse.of(GOOD_ANSWER, ResponseStrategy.PRIMARY));

        PortfolioAnswer answer = orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults());

        assertThat((List<?>) answer.metadata().get("events")).isEmpty();
        verify(queryLogService).recordQuery(any(), eq(answer), any(), anyLong());
    }

    @Test
    void streamEmitsOrderedEventsEndingWithTheAnswer() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(DraftResponse.of(GOOD_ANSWER, ResponseStrategy.PRIMARY));

        List<ThinkingEvent> seen = new CopyOnWriteArrayList<>();
        StepVerifier.create(orchestrator().streamQuery("What degree did you study?", QueryOptions.defaults())
                        .doOnNext(seen::add))
                .expectNextMatches(e -> e.type().equals("start"))
                .thenConsumeWhile(e -> !e.type().equals("answer_final"))
                .expectNextMatches(e -> e.payload() instanceof PortfolioAnswer)
                .expectComplete()
                .verify(Duration.ofSeconds(10));

        assertThat(seen).extracting(ThinkingEvent::type)
                .contains("intent", "retrieval", "draft", "validation");
        assertThat(seen).extracting(ThinkingEvent::timestamp).isSorted();
    }

    @Test
    void emittedEventsAreCountedByType() {
        when(retrievalService.retrieve(anyString(), anyInt(), any())).thenReturn(educationHits());
        when(responder.respond(any())).thenReturn(
                DraftResponse.of("Too short.", ResponseStrategy.PRIMARY),
                DraftResponse.of(GOOD_ANSWER, ResponseStrategy.PRIMARY));

        orchestrator().handleQuery("What degree did you study?", QueryOptions.defaults().withStream(true));

        assertThat(eventCount("start")).isEqualTo(1.0);
        assertThat(eventCount("retrieval")).isEqualTo(2.0);
        assertThat(eventCount("retry")).isEqualTo(1.0);
        assertThat(eventCount("answer_final")).isEqualTo(1.0);
        assertThat(meterRegistry.get(MetricsRecorder.EVENT_COUNTER)
                .tag("name", "query_completed")
                .tag("degraded", "false")
                .counter().count()).isEqualTo(1.0);
    }

    private double eventCount(String type) {
        return meterRegistry.get(MetricsRecorder.EVENT_COUNTER)
                .tag("name", PortfolioQueryOrchestrator.EVENT_METRIC)
                .tag("type", type)
                .counter().count();
    }
}

package ru.oparin.calendar.service.conversation;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.calendar.exception.ConversationInputException;
import ru.oparin.calendar.exception.StorageUnavailableException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ConversationEngineTest {

    private static final Long USER = 1L;

    private ConversationEngine engine;

    @BeforeEach
    void setUp() {
        ConversationSessionStore store = new CaffeineConversationSessionStore(Caffeine.newBuilder().build());
        engine = new ConversationEngine(store, Clock.fixed(Instant.parse("2025-11-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createFlowCompletesWithAllFieldsInSubmissionOrder() {
        // Given
        engine.startFlow(USER, FlowType.CREATE);

        // When
        SubmitResult name = engine.submit(USER, "Встреча с командой");
        SubmitResult date = engine.submit(USER, "2025-12-12");
        SubmitResult time = engine.submit(USER, "12:00");
        SubmitResult details = engine.submit(USER, "Обсудить релиз");

        // Then
        assertThat(name.getOutcome()).isEqualTo(SubmitResult.Outcome.ADVANCED);
        assertThat(name.getStep()).isEqualTo(FlowStep.DATE);
        assertThat(date.getStep()).isEqualTo(FlowStep.TIME);
        assertThat(time.getStep()).isEqualTo(FlowStep.DETAILS);
        assertThat(details.getOutcome()).isEqualTo(SubmitResult.Outcome.COMPLETED);
        assertThat(details.getFields()).containsExactly(
                entry("name", "Встреча с командой"),
                entry("date", LocalDate.of(2025, 12, 12)),
                entry("time", LocalTime.of(12, 0)),
                entry("details", "Обсудить релиз"));
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.NONE);
    }

    @Test
    void oneInputShortOfTheFlowNeverCompletes() {
        engine.startFlow(USER, FlowType.CREATE);

        assertThat(engine.submit(USER, "Обед").is(SubmitResult.Outcome.COMPLETED)).isFalse();
        assertThat(engine.submit(USER, "2025-12-12").is(SubmitResult.Outcome.COMPLETED)).isFalse();
        assertThat(engine.submit(USER, "13:00").is(SubmitResult.Outcome.COMPLETED)).isFalse();
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.CREATE);
    }

    @Test
    void parseFailureKeepsTheSameStep() {
        // Given
        engine.startFlow(USER, FlowType.CREATE);
        engine.submit(USER, "Обед");

        // When
        SubmitResult failed = engine.submit(USER, "завтра");

        // Then
        assertThat(failed.getOutcome()).isEqualTo(SubmitResult.Outcome.FAILED);
        assertThat(failed.getStep()).isEqualTo(FlowStep.DATE);
        assertThat(failed.getReason()).contains("Неверный формат");
        assertThat(engine.submit(USER, "2025-12-12").getStep()).isEqualTo(FlowStep.TIME);
    }

    @Test
    void inputWithoutSessionIsReportedAsNoSession() {
        assertThat(engine.submit(USER, "привет").getOutcome()).isEqualTo(SubmitResult.Outcome.NO_SESSION);
    }

    @Test
    void cancelIsIdempotent() {
        engine.startFlow(USER, FlowType.DELETE);

        assertThat(engine.cancel(USER)).isTrue();
        assertThat(engine.cancel(USER)).isFalse();
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.NONE);
    }

    @Test
    void startingNewFlowReplacesActiveOne() {
        engine.startFlow(USER, FlowType.CREATE);
        engine.submit(USER, "Обед");

        FlowStart start = engine.startFlow(USER, FlowType.INVITE);

        assertThat(start.replacedFlow()).contains(FlowType.CREATE);
        assertThat(start.firstStep()).isEqualTo(FlowStep.PARTICIPANT_ID);
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.INVITE);
    }

    @Test
    void sessionsOfDifferentUsersAreIndependent() {
        engine.startFlow(1L, FlowType.DELETE);
        engine.startFlow(2L, FlowType.EDIT);

        engine.cancel(1L);

        assertThat(engine.activeFlow(2L)).isEqualTo(FlowType.EDIT);
    }

    @Test
    void validatorRejectionKeepsStep() {
        // Given
        engine.startFlow(USER, FlowType.DELETE);
        StepValidator rejectAll = (session, step, value) ->
                Mono.error(new ConversationInputException("Событие не найдено. Укажите корректный ID:"));

        // When / Then
        StepVerifier.create(engine.submit(USER, "7", rejectAll))
                .assertNext(result -> {
                    assertThat(result.getOutcome()).isEqualTo(SubmitResult.Outcome.FAILED);
                    assertThat(result.getStep()).isEqualTo(FlowStep.EVENT_ID);
                })
                .verifyComplete();
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.DELETE);
    }

    @Test
    void storageFailureInValidatorPropagatesAndLeavesSessionUntouched() {
        engine.startFlow(USER, FlowType.EDIT);
        StepValidator unavailable = (session, step, value) ->
                Mono.error(new StorageUnavailableException("db down", new RuntimeException()));

        StepVerifier.create(engine.submit(USER, "7", unavailable))
                .expectError(StorageUnavailableException.class)
                .verify();

        StepVerifier.create(engine.submit(USER, "7", StepValidator.NONE))
                .assertNext(result -> assertThat(result.getStep()).isEqualTo(FlowStep.NEW_DETAILS))
                .verifyComplete();
    }

    @Test
    void restoreReturnsSessionToLastStep() {
        // Given
        engine.startFlow(USER, FlowType.DELETE);
        SubmitResult completed = engine.submit(USER, "5");

        // When
        engine.restore(completed.getResumePoint());

        // Then
        assertThat(engine.activeFlow(USER)).isEqualTo(FlowType.DELETE);
        SubmitResult again = engine.submit(USER, "5");
        assertThat(again.getOutcome()).isEqualTo(SubmitResult.Outcome.COMPLETED);
        assertThat(again.id(FlowStep.EVENT_ID)).isEqualTo(5L);
    }

    @Test
    void recognizesCancelWords() {
        assertThat(ConversationEngine.isCancelWord("Отмена")).isTrue();
        assertThat(ConversationEngine.isCancelWord("/cancel")).isTrue();
        assertThat(ConversationEngine.isCancelWord("отменить встречу")).isFalse();
    }
}

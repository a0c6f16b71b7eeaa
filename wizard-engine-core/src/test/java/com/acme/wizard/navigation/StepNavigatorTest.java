package com.acme.wizard.navigation;

import static org.assertj.core.api.Assertions.*;

import com.acme.wizard.context.ContextView;
import com.acme.wizard.context.WizardContext;
import com.acme.wizard.guard.IdempotencyGuard;
import com.acme.wizard.remote.DefaultErrorClassifier;
import com.acme.wizard.remote.ErrorKind;
import com.acme.wizard.step.FieldError;
import com.acme.wizard.step.LocalStep;
import com.acme.wizard.step.StepDescriptor;
import com.acme.wizard.step.StepOutcome;
import com.acme.wizard.step.StepState;
import com.acme.wizard.step.StepStatus;
import com.acme.wizard.step.StepValidator;
import com.acme.wizard.step.WizardStep;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StepNavigatorTest {

  private final List<String> calls = new ArrayList<>();
  private WizardContext context;
  private IdempotencyGuard guard;
  private RecordingStep first;
  private RecordingStep second;
  private RecordingStep third;
  private int finishCalls;
  private StepNavigator navigator;

  /** Local step that records its callbacks */
  private class RecordingStep extends LocalStep {
    RecordingStep(String id, StepValidator... validators) {
      super(StepDescriptor.of(id).produces(id + "Value"), validators);
    }

    @Override
    protected void onSetup() {
      calls.add(id() + ":setup");
    }

    @Override
    public void onShow(ContextView view) {
      super.onShow(view);
      calls.add(id() + ":show");
    }

    @Override
    public void onHide(ContextView view) {
      calls.add(id() + ":hide");
    }
  }

  @BeforeEach
  void setUp() {
    context = new WizardContext();
    guard = new IdempotencyGuard();
    first = new RecordingStep("first");
    second = new RecordingStep("second", StepValidator.required("secondValue", "required"));
    third = new RecordingStep("third");
    finishCalls = 0;
    navigator =
        new StepNavigator(
            List.of(first, second, third),
            context,
            guard,
            new DefaultErrorClassifier(),
            () -> {
              finishCalls++;
              return NavigationResult.finished(2, "third");
            });
  }

  @Nested
  @DisplayName("Forward navigation")
  class ForwardTests {

    @Test
    @DisplayName("should show the first step on start")
    void testStart() {
      navigator.start();

      assertThat(navigator.current()).isZero();
      assertThat(navigator.statusOf(0)).isEqualTo(StepStatus.ACTIVE);
      assertThat(calls).containsExactly("first:setup", "first:show");
    }

    @Test
    @DisplayName("should commit, hide and show on a successful next")
    void testNext() {
      navigator.start();
      first.edit("firstValue", "a");

      NavigationResult result = navigator.goNext();

      assertThat(result.moved()).isTrue();
      assertThat(result.index()).isEqualTo(1);
      assertThat(navigator.statusOf(0)).isEqualTo(StepStatus.COMPLETED);
      assertThat(navigator.statusOf(1)).isEqualTo(StepStatus.ACTIVE);
      assertThat(calls).containsSubsequence("first:hide", "second:setup", "second:show");
      assertThat(guard.hasCommitted("first")).isTrue();
    }

    @Test
    @DisplayName("should stay on the step when validation fails")
    void testInvalid() {
      navigator.start();
      first.edit("firstValue", "a");
      navigator.goNext();
      second.edit("secondValue", " ");

      NavigationResult result = navigator.goNext();

      assertThat(result.kind()).isEqualTo(NavigationResult.Kind.INVALID);
      assertThat(result.index()).isEqualTo(1);
      assertThat(result.message()).isEqualTo("secondValue: required");
      assertThat(guard.hasCommitted("second")).isFalse();
    }

    @Test
    @DisplayName("should hand over to finish on the last step without moving")
    void testFinishHandover() {
      navigator.start();
      first.edit("firstValue", "a");
      navigator.goNext();
      second.edit("secondValue", "b");
      navigator.goNext();
      third.edit("thirdValue", "c");

      NavigationResult result = navigator.goNext();

      assertThat(result.kind()).isEqualTo(NavigationResult.Kind.FINISHED);
      assertThat(finishCalls).isEqualTo(1);
      assertThat(navigator.current()).isEqualTo(2);
      assertThat(navigator.completedCount()).isEqualTo(3);
      assertThat(calls).doesNotContain("third:hide");
    }

    @Test
    @DisplayName("should not commit a step whose own value was never entered")
    void testMissingLocalValue() {
      navigator.start();

      NavigationResult result = navigator.goNext();

      assertThat(result.kind()).isEqualTo(NavigationResult.Kind.INVALID);
      assertThat(result.validation().errors())
          .extracting(FieldError::field)
          .containsExactly("firstValue");
      assertThat(guard.hasCommitted("first")).isFalse();
      assertThat(context.contains("firstValue")).isFalse();
    }

    @Test
    @DisplayName("should classify an exception thrown by a step")
    void testThrowingStep() {
      WizardStep broken =
          new LocalStep(StepDescriptor.of("broken")) {
            @Override
            protected StepOutcome commit(WizardContext ctx, IdempotencyGuard g) {
              throw new IllegalStateException("boom");
            }
          };
      StepNavigator single =
          new StepNavigator(
              List.of(broken), context, guard, new DefaultErrorClassifier(), () -> null);
      single.start();

      NavigationResult result = single.goNext();

      assertThat(result.kind()).isEqualTo(NavigationResult.Kind.FATAL);
      assertThat(result.failure().kind()).isEqualTo(ErrorKind.UNEXPECTED);
    }
  }

  @Nested
  @DisplayName("Backward navigation")
  class BackwardTests {

    @Test
    @DisplayName("should be a no-op on the first step")
    void testBackAtStart() {
      navigator.start();

      NavigationResult result = navigator.goBack();

      assertThat(result.kind()).isEqualTo(NavigationResult.Kind.NO_OP);
      assertThat(navigator.current()).isZero();
      assertThat(navigator.canGoBack()).isFalse();
    }

    @Test
    @DisplayName("should not validate or commit when going back")
    void testBackSkipsValidation() {
      navigator.start();
      first.edit("firstValue", "a");
      navigator.goNext();
      calls.clear();

      NavigationResult result = navigator.goBack();

      assertThat(result.moved()).isTrue();
      assertThat(calls).containsExactly("second:hide", "first:show");
      assertThat(guard.hasCommitted("second")).isFalse();
    }

    @Test
    @DisplayName("should keep context and guard when going back and forward again")
    void testBackThenNext() {
      navigator.start();
      first.edit("firstValue", "a");
      navigator.goNext();
      Object snapshot = context.toSnapshot();

      navigator.goBack();
      NavigationResult result = navigator.goNext();

      assertThat(result.moved()).isTrue();
      assertThat(context.toSnapshot()).isEqualTo(snapshot);
      assertThat(guard.flags()).containsOnlyKeys("first");
      assertThat(calls).filteredOn("first:setup"::equals).hasSize(1);
    }
  }

  @Nested
  @DisplayName("Jump back")
  class GoToTests {

    @BeforeEach
    void advanceToLast() {
      navigator.start();
      first.edit("firstValue", "a");
      navigator.goNext();
      second.edit("secondValue", "b");
      navigator.goNext();
      calls.clear();
    }

    @Test
    @DisplayName("should jump to an earlier step showing only that step")
    void testGoTo() {
      NavigationResult result = navigator.goTo(0);

      assertThat(result.moved()).isTrue();
      assertThat(result.stepId()).isEqualTo("first");
      assertThat(navigator.current()).isZero();
      assertThat(calls).containsExactly("third:hide", "first:show");
      assertThat(guard.flags()).containsOnlyKeys("first", "second");
      assertThat(navigator.statusOf(1)).isEqualTo(StepStatus.COMPLETED);
    }

    @Test
    @DisplayName("should not move to the current or a later step")
    void testGoToForward() {
      navigator.goTo(1);
      calls.clear();

      assertThat(navigator.goTo(1).kind()).isEqualTo(NavigationResult.Kind.NO_OP);
      assertThat(navigator.goTo(2).kind()).isEqualTo(NavigationResult.Kind.NO_OP);
      assertThat(navigator.current()).isEqualTo(1);
      assertThat(calls).isEmpty();
    }

    @Test
    @DisplayName("should reject an index outside the step range")
    void testGoToOutOfRange() {
      assertThatThrownBy(() -> navigator.goTo(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
  }

  @Nested
  @DisplayName("Resume")
  class ResumeTests {

    @Test
    @DisplayName("should show only the target step and derive statuses")
    void testResumeAt() {
      guard.markCommitted("first");
      guard.markCommitted("third");

      navigator.resumeAt(1);

      assertThat(calls).containsExactly("second:setup", "second:show");
      assertThat(navigator.states())
          .extracting(StepState::status)
          .containsExactly(StepStatus.COMPLETED, StepStatus.ACTIVE, StepStatus.COMPLETED);
      assertThat(navigator.progressPercentage()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("should reject an index outside the step range")
    void testResumeOutOfRange() {
      assertThatThrownBy(() -> navigator.resumeAt(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }
  }

  @Test
  @DisplayName("should refuse navigation before start")
  void testNotStarted() {
    assertThatThrownBy(() -> navigator.goNext()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should walk back to a reopened step")
  void testReopen() {
    navigator.start();
    first.edit("firstValue", "a");
    navigator.goNext();

    navigator.reopen(0);

    assertThat(navigator.current()).isZero();
    assertThat(navigator.statusOf(0)).isEqualTo(StepStatus.ACTIVE);
  }
}

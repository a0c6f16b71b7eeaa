package com.acme.wizard;

import static org.assertj.core.api.Assertions.*;

import com.acme.wizard.step.LocalStep;
import com.acme.wizard.step.StepDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WizardDefinitionBuilderTest {

  @Test
  @DisplayName("should create fresh step instances for every call")
  void testFreshSteps() {
    WizardDefinition definition =
        WizardDefinitionBuilder.wizard("survey")
            .step(() -> new LocalStep(StepDescriptor.of("details")))
            .step(() -> new LocalStep(StepDescriptor.of("confirm")))
            .build();

    assertThat(definition.getStepCount()).isEqualTo(2);
    assertThat(definition.newSteps().get(0)).isNotSameAs(definition.newSteps().get(0));
    assertThat(definition.getFinishService()).isNull();
  }

  @Test
  @DisplayName("should reject a wizard without steps")
  void testNoSteps() {
    assertThatThrownBy(() -> WizardDefinitionBuilder.wizard("survey").build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should reject duplicate and reserved step ids")
  void testDuplicateIds() {
    WizardDefinition duplicate =
        WizardDefinitionBuilder.wizard("survey")
            .step(() -> new LocalStep(StepDescriptor.of("details")))
            .step(() -> new LocalStep(StepDescriptor.of("details")))
            .build();
    WizardDefinition reserved =
        WizardDefinitionBuilder.wizard("survey")
            .step(() -> new LocalStep(StepDescriptor.of(WizardDefinition.FINISH_GUARD_KEY)))
            .build();

    assertThatThrownBy(duplicate::newSteps).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(reserved::newSteps).isInstanceOf(IllegalStateException.class);
  }
}

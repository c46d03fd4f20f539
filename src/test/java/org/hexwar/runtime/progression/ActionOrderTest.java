package org.hexwar.runtime.progression;

import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.rules.RulesDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ActionOrderTest {

    @Test
    @DisplayName("Parses slots and alternatives")
    void parsesSlotsAndAlternatives() {
        ActionOrder order = ActionOrder.parse(List.of("move", "attack | capture", "retreat"));

        assertThat(order.size()).isEqualTo(3);
        assertThat(order.slot(0)).containsExactly(ActionKind.MOVE);
        assertThat(order.slot(1)).containsExactly(ActionKind.ATTACK, ActionKind.CAPTURE);
        assertThat(order.hasAlternatives(1)).isTrue();
        assertThat(order.hasAlternatives(0)).isFalse();
    }

    @Test
    @DisplayName("Steps outside the order are empty")
    void stepsOutsideTheOrderAreEmpty() {
        ActionOrder order = ActionOrder.parse(List.of("move"));

        assertThat(order.slot(1)).isEmpty();
        assertThat(order.slot(-1)).isEmpty();
        assertThat(order.movementSlot(1)).isFalse();
    }

    @Test
    @DisplayName("Movement slots contain only movement")
    void movementSlotsContainOnlyMovement() {
        ActionOrder order = ActionOrder.parse(List.of("move|retreat", "move|attack", "attack"));

        assertThat(order.movementSlot(0)).isTrue();
        assertThat(order.movementSlot(1)).isFalse();
        assertThat(order.movementSlot(2)).isFalse();
    }

    @Test
    @DisplayName("Unknown actions are rejected")
    void unknownActionsAreRejected() {
        assertThatThrownBy(() -> ActionOrder.parse(List.of("move", "fly")))
                .isInstanceOf(RulesDefinitionException.class)
                .hasMessageContaining("fly");
    }
}

package org.hexwar.runtime.moves;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.hexwar.runtime.model.AxialCoord;

/**
 * A resolved player action. Coordinates and ids are final; label and direction resolution
 * happens before a move reaches the processor.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Move.MoveUnit.class, name = "move"),
        @JsonSubTypes.Type(value = Move.AttackUnit.class, name = "attack"),
        @JsonSubTypes.Type(value = Move.BuildUnit.class, name = "build"),
        @JsonSubTypes.Type(value = Move.CaptureBuilding.class, name = "capture"),
        @JsonSubTypes.Type(value = Move.HealUnit.class, name = "heal"),
        @JsonSubTypes.Type(value = Move.EndTurn.class, name = "endTurn")
})
public sealed interface Move
        permits Move.MoveUnit, Move.AttackUnit, Move.BuildUnit, Move.CaptureBuilding, Move.HealUnit, Move.EndTurn {

    /**
     * Discriminator used for exhaustive dispatch.
     */
    enum Kind {
        MOVE_UNIT, ATTACK_UNIT, BUILD_UNIT, CAPTURE_BUILDING, HEAL_UNIT, END_TURN
    }

    @JsonIgnore
    Kind kind();

    /**
     * Moves the unit at {@code from} to the unoccupied coordinate {@code to}.
     */
    record MoveUnit(AxialCoord from, AxialCoord to) implements Move {
        @Override
        public Kind kind() {
            return Kind.MOVE_UNIT;
        }
    }

    /**
     * The unit at {@code attacker} attacks the unit at {@code defender}.
     */
    record AttackUnit(AxialCoord attacker, AxialCoord defender) implements Move {
        @Override
        public Kind kind() {
            return Kind.ATTACK_UNIT;
        }
    }

    /**
     * Builds a unit of {@code unitType} on the owned tile at {@code pos}.
     */
    record BuildUnit(AxialCoord pos, int unitType) implements Move {
        @Override
        public Kind kind() {
            return Kind.BUILD_UNIT;
        }
    }

    /**
     * Starts capturing the tile under the unit at {@code pos}.
     */
    record CaptureBuilding(AxialCoord pos) implements Move {
        @Override
        public Kind kind() {
            return Kind.CAPTURE_BUILDING;
        }
    }

    /**
     * Heals the unit at {@code pos} on its current terrain.
     */
    record HealUnit(AxialCoord pos) implements Move {
        @Override
        public Kind kind() {
            return Kind.HEAL_UNIT;
        }
    }

    /**
     * Ends the current player's turn.
     */
    record EndTurn() implements Move {
        @Override
        public Kind kind() {
            return Kind.END_TURN;
        }
    }

    static MoveUnit move(int fromQ, int fromR, int toQ, int toR) {
        return new MoveUnit(AxialCoord.of(fromQ, fromR), AxialCoord.of(toQ, toR));
    }

    static AttackUnit attack(int attackerQ, int attackerR, int defenderQ, int defenderR) {
        return new AttackUnit(AxialCoord.of(attackerQ, attackerR), AxialCoord.of(defenderQ, defenderR));
    }

    static BuildUnit build(int q, int r, int unitType) {
        return new BuildUnit(AxialCoord.of(q, r), unitType);
    }

    static CaptureBuilding capture(int q, int r) {
        return new CaptureBuilding(AxialCoord.of(q, r));
    }

    static HealUnit heal(int q, int r) {
        return new HealUnit(AxialCoord.of(q, r));
    }

    static EndTurn endTurn() {
        return new EndTurn();
    }
}

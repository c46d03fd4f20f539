package org.hexwar.runtime.moves;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.hexwar.runtime.model.Tile;
import org.hexwar.runtime.model.Unit;

import java.util.List;

/**
 * One observable effect of an applied move. Changes carry complete unit and tile records, so a
 * replica can reproduce a move by applying them in order without running any rules.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Change.UnitMoved.class, name = "unitMoved"),
        @JsonSubTypes.Type(value = Change.UnitDamaged.class, name = "unitDamaged"),
        @JsonSubTypes.Type(value = Change.UnitKilled.class, name = "unitKilled"),
        @JsonSubTypes.Type(value = Change.UnitBuilt.class, name = "unitBuilt"),
        @JsonSubTypes.Type(value = Change.UnitHealed.class, name = "unitHealed"),
        @JsonSubTypes.Type(value = Change.CoinsChanged.class, name = "coinsChanged"),
        @JsonSubTypes.Type(value = Change.PlayerChanged.class, name = "playerChanged"),
        @JsonSubTypes.Type(value = Change.CaptureStarted.class, name = "captureStarted"),
        @JsonSubTypes.Type(value = Change.CaptureCompleted.class, name = "captureCompleted"),
        @JsonSubTypes.Type(value = Change.TileOwnershipChanged.class, name = "tileOwnershipChanged")
})
public sealed interface Change permits Change.UnitMoved, Change.UnitDamaged, Change.UnitKilled, Change.UnitBuilt,
        Change.UnitHealed, Change.CoinsChanged, Change.PlayerChanged, Change.CaptureStarted,
        Change.CaptureCompleted, Change.TileOwnershipChanged {

    enum Kind {
        UNIT_MOVED, UNIT_DAMAGED, UNIT_KILLED, UNIT_BUILT, UNIT_HEALED, COINS_CHANGED, PLAYER_CHANGED,
        CAPTURE_STARTED, CAPTURE_COMPLETED, TILE_OWNERSHIP_CHANGED
    }

    @JsonIgnore
    Kind kind();

    /**
     * A unit changed position or progression state. {@code previous} and {@code updated} may
     * share a coordinate when only the unit's state changed.
     */
    record UnitMoved(Unit previous, Unit updated) implements Change {
        @Override
        public Kind kind() {
            return Kind.UNIT_MOVED;
        }
    }

    record UnitDamaged(Unit previous, Unit updated, int damage) implements Change {
        @Override
        public Kind kind() {
            return Kind.UNIT_DAMAGED;
        }
    }

    /**
     * A unit reached zero health and left the world.
     */
    record UnitKilled(Unit unit) implements Change {
        @Override
        public Kind kind() {
            return Kind.UNIT_KILLED;
        }
    }

    /**
     * @param unit        the new unit.
     * @param tile        the building tile, marked as used this turn.
     * @param cost        coins paid.
     * @param playerCoins the builder's balance after paying.
     */
    record UnitBuilt(Unit unit, Tile tile, int cost, int playerCoins) implements Change {
        @Override
        public Kind kind() {
            return Kind.UNIT_BUILT;
        }
    }

    record UnitHealed(Unit previous, Unit updated, int amount) implements Change {
        @Override
        public Kind kind() {
            return Kind.UNIT_HEALED;
        }
    }

    /**
     * @param reason what caused the change, e.g. {@code income}.
     */
    record CoinsChanged(int player, int previousCoins, int newCoins, String reason) implements Change {
        @Override
        public Kind kind() {
            return Kind.COINS_CHANGED;
        }
    }

    /**
     * The turn passed to another player.
     *
     * @param resetUnits the incoming player's units after their refresh.
     * @param winner     the winning player, 0 while the game continues.
     */
    record PlayerChanged(int previousPlayer, int newPlayer, int previousTurn, int newTurn,
                         List<Unit> resetUnits, int winner) implements Change {
        public PlayerChanged {
            resetUnits = resetUnits == null ? List.of() : List.copyOf(resetUnits);
        }

        @Override
        public Kind kind() {
            return Kind.PLAYER_CHANGED;
        }
    }

    /**
     * A unit began capturing the tile it stands on. Ownership is unchanged until the unit's
     * next refresh.
     */
    record CaptureStarted(Unit previous, Unit updated, Tile tile) implements Change {
        @Override
        public Kind kind() {
            return Kind.CAPTURE_STARTED;
        }
    }

    /**
     * A capture finished during the capturing unit's refresh.
     */
    record CaptureCompleted(Unit unit, Tile previous, Tile updated) implements Change {
        @Override
        public Kind kind() {
            return Kind.CAPTURE_COMPLETED;
        }
    }

    record TileOwnershipChanged(Tile previous, Tile updated) implements Change {
        @Override
        public Kind kind() {
            return Kind.TILE_OWNERSHIP_CHANGED;
        }
    }
}

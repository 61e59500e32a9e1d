package com.brandish.progression.tree;

import com.brandish.progression.model.DynamicPrerequisite;
import com.brandish.progression.model.DynamicPrerequisiteType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrerequisiteParserTest {

    @Test
    void plainKeyIsStaticPrerequisite() {
        ParsedPrerequisite parsed = PrerequisiteParser.parse("feature_economy");

        assertFalse(parsed.isDynamic());
        assertEquals("feature_economy", parsed.staticKey());
        assertNull(parsed.dynamicPrerequisite());
    }

    @Test
    void parsesNodesUnlockedBelowTier() {
        ParsedPrerequisite parsed = PrerequisiteParser.parse("-nodes_unlocked_below_tier:2:5");

        assertTrue(parsed.isDynamic());
        assertEquals(DynamicPrerequisite.nodesUnlockedBelowTier(2, 5), parsed.dynamicPrerequisite());
    }

    @Test
    void parsesTotalNodesUnlocked() {
        ParsedPrerequisite parsed = PrerequisiteParser.parse("-total_nodes_unlocked:12");

        assertTrue(parsed.isDynamic());
        assertEquals(DynamicPrerequisiteType.TOTAL_NODES_UNLOCKED, parsed.dynamicPrerequisite().type());
        assertEquals(12, parsed.dynamicPrerequisite().count());
    }

    @Test
    void rejectsWrongArityAndBadNumbers() {
        IllegalArgumentException arity = assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.parse("-nodes_unlocked_below_tier:2"));
        assertTrue(arity.getMessage().startsWith("invalid syntax"));

        IllegalArgumentException tier = assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.parse("-nodes_unlocked_below_tier:x:5"));
        assertTrue(tier.getMessage().startsWith("invalid tier"));

        IllegalArgumentException count = assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.parse("-total_nodes_unlocked:many"));
        assertTrue(count.getMessage().startsWith("invalid count"));
    }

    @Test
    void rejectsUnknownDynamicTypeAndBlankInput() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.parse("-nodes_in_category:3"));
        assertTrue(unknown.getMessage().startsWith("unknown dynamic prerequisite type"));

        assertThrows(IllegalArgumentException.class, () -> PrerequisiteParser.parse("  "));
    }

    @Test
    void validateRequiresPositiveCountAndNonNegativeTier() {
        assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.validate(DynamicPrerequisite.totalNodesUnlocked(0)));
        assertThrows(IllegalArgumentException.class,
                () -> PrerequisiteParser.validate(DynamicPrerequisite.nodesUnlockedBelowTier(-1, 3)));

        PrerequisiteParser.validate(DynamicPrerequisite.nodesUnlockedBelowTier(0, 1));
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.vigil.watch;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import sh.vigil.core.model.ChainEvent;

class EventPatternTest {

    private static ChainEvent event(String section, String method) {
        return new ChainEvent(section, method, null, 1, MockChain.hashOf(1), 0);
    }

    @Test
    void parseSplitsAtFirstColon() {
        EventPattern pattern = EventPattern.parse("swapping:SwapExecuted");

        assertEquals("swapping", pattern.section());
        assertEquals("SwapExecuted", pattern.method());
        assertEquals("swapping:SwapExecuted", pattern.toString());
    }

    @Test
    void parseWithoutColonSelectsWholeSection() {
        EventPattern pattern = EventPattern.parse("swapping");

        assertEquals("swapping", pattern.section());
        assertEquals("", pattern.method());
        assertTrue(pattern.matches(event("swapping", "Anything"), MatchMode.EXACT));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    void parseRejectsBlank(String pattern) {
        assertThrows(IllegalArgumentException.class, () -> EventPattern.parse(pattern));
    }

    @ParameterizedTest
    @CsvSource({
            "swapping:SwapExecuted, swapping, SwapExecuted, true",
            "swapping:Swap, swapping, SwapExecuted, true",
            "swap:Executed, swapping, SwapExecuted, true",
            ":SwapExecuted, liquidityPools, SwapExecuted, true",
            "swapping:, swapping, SwapScheduled, true",
            "swapping:SwapExecuted, liquidityPools, SwapExecuted, false",
            "swapping:Refunded, swapping, SwapExecuted, false"
    })
    void substringMatching(String pattern, String section, String method, boolean expected) {
        assertEquals(expected, EventPattern.parse(pattern).matches(event(section, method), MatchMode.SUBSTRING));
    }

    @ParameterizedTest
    @CsvSource({
            "balances:Transfer, balances, Transfer, true",
            "balances:Transfer, balances, TransferAll, false",
            "balance:Transfer, balances, Transfer, false",
            ":Transfer, assets, Transfer, true"
    })
    void exactMatching(String pattern, String section, String method, boolean expected) {
        assertEquals(expected, EventPattern.parse(pattern).matches(event(section, method), MatchMode.EXACT));
    }
}

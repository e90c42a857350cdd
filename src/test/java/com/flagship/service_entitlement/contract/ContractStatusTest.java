package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static com.flagship.service_entitlement.contract.ContractStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class ContractStatusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private static final Set<String> ALLOWED = Set.of(
        "DRAFT->SIGNED",
        "SIGNED->DRAFT",
        "SIGNED->ACTIVE",
        "SUSPENDED->ACTIVE",
        "ACTIVE->SUSPENDED",
        "ACTIVE->COMPLETED",
        "ACTIVE->TERMINATED",
        "SUSPENDED->TERMINATED"
    );

    static Stream<Arguments> allPairs() {
        return Arrays.stream(values())
            .flatMap(from -> Arrays.stream(values()).map(to -> Arguments.of(from, to)));
    }

    static Stream<Arguments> disallowedPairs() {
        return allPairs().filter(pair -> !ALLOWED.contains(pair.get()[0] + "->" + pair.get()[1]));
    }

    private static Contract contractIn(ContractStatus status) {
        return Contract.builder()
            .id(UUID.randomUUID())
            .studentId(UUID.randomUUID())
            .status(status)
            .validityDays(365)
            .createdAt(NOW)
            .updatedAt(NOW)
            .build();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("allPairs")
    @DisplayName("the status table allows exactly the listed moves")
    void everyPair(ContractStatus from, ContractStatus to) {
        assertEquals(ALLOWED.contains(from + "->" + to), from.canTransitionTo(to));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("disallowedPairs")
    @DisplayName("a contract rejects every move outside the table")
    void disallowedMovesThrow(ContractStatus from, ContractStatus to) {
        Contract contract = contractIn(from);

        assertThrows(InvalidStateTransitionException.class, () -> contract.transitionTo(to, "ops request", NOW));
    }

    @Test
    @DisplayName("ACTIVE to ACTIVE reports that the contract is already active")
    void alreadyActive() {
        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
            () -> contractIn(ACTIVE).transitionTo(ACTIVE, null, NOW));

        assertTrue(e.getMessage().contains("already active"));
    }

    @Test
    @DisplayName("COMPLETED and TERMINATED are the only terminal states")
    void terminalStates() {
        for (ContractStatus status : ContractStatus.values()) {
            boolean expected = status == COMPLETED || status == TERMINATED;
            assertEquals(expected, status.isTerminal(), status.name());
        }
    }

    @Test
    @DisplayName("suspension and termination need a reason")
    void reasonRequired() {
        assertTrue(ContractStatus.requiresReason(ContractStatus.SUSPENDED));
        assertTrue(ContractStatus.requiresReason(ContractStatus.TERMINATED));
        assertFalse(ContractStatus.requiresReason(ContractStatus.ACTIVE));
        assertFalse(ContractStatus.requiresReason(ContractStatus.COMPLETED));
    }
}

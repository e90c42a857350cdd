package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.LockTimeoutException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.lock.RowLocks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractPersistenceServiceTest {

    @Mock
    private ContractRepository contractRepository;
    @Mock
    private ContractStatusHistoryRepository historyRepository;
    @Mock
    private JdbcTemplate jdbcTemplate;

    private ContractPersistenceService persistenceService;

    @BeforeEach
    void setUp() {
        persistenceService = new ContractPersistenceService(contractRepository, historyRepository,
            new RowLocks(jdbcTemplate, 2000));
    }

    @Test
    @DisplayName("lockById bounds the wait on the contract row")
    void lockTimeoutOnContract() {
        UUID contractId = UUID.randomUUID();
        when(contractRepository.findByIdForUpdate(contractId))
            .thenThrow(new CannotAcquireLockException("canceling statement due to lock timeout"));

        LockTimeoutException e = assertThrows(LockTimeoutException.class,
            () -> persistenceService.lockById(contractId));

        assertTrue(e.isRetryable());
        assertTrue(e.getMessage().contains(contractId.toString()));
        InOrder order = inOrder(jdbcTemplate, contractRepository);
        order.verify(jdbcTemplate).execute("SET LOCAL lock_timeout = '2000ms'");
        order.verify(contractRepository).findByIdForUpdate(contractId);
    }

    @Test
    @DisplayName("lockById reports a missing contract as not found")
    void missingContract() {
        UUID contractId = UUID.randomUUID();
        when(contractRepository.findByIdForUpdate(contractId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> persistenceService.lockById(contractId));
    }
}

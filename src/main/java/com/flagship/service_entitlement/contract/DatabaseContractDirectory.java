package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.lock.RowLocks;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ContractDirectory} backed by the service's own contracts table and the
 * catalog's replicated product_service_items table.
 */
@Component
@RequiredArgsConstructor
public class DatabaseContractDirectory implements ContractDirectory {

    private final ContractRepository contractRepository;
    private final JdbcTemplate jdbcTemplate;
    private final RowLocks rowLocks;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> findContract(UUID contractId) {
        return rowLocks.lock("contract " + contractId, () -> contractRepository.findByIdForShare(contractId))
            .map(ContractEntity::toDomain);
    }

    @Override
    public List<ProductItem> listProductItems(UUID productId) {
        return jdbcTemplate.query(
            "SELECT service_type, quantity FROM product_service_items WHERE product_id = ? ORDER BY id",
            (rs, rowNum) -> new ProductItem(rs.getString("service_type"), rs.getInt("quantity")),
            productId
        );
    }
}

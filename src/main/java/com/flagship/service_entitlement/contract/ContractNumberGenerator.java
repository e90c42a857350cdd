package com.flagship.service_entitlement.contract;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates human-readable contract numbers such as {@code CT-202405-00042}.
 * The numeric part comes from a database sequence and is unique across months.
 */
@Component
@RequiredArgsConstructor
public class ContractNumberGenerator {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM").withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public String next() {
        Long sequence = jdbcTemplate.queryForObject("SELECT nextval('contract_number_seq')", Long.class);
        if (sequence == null) {
            throw new IllegalStateException("contract_number_seq returned no value");
        }
        return String.format("CT-%s-%05d", MONTH.format(clock.instant()), sequence);
    }
}

package com.flagship.class_enrollment.credit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.class_enrollment.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CreditLedgerTest {

    private JdbcTemplate jdbcTemplate;
    private CreditLedger ledger;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        ledger = new CreditLedger(jdbcTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Requested credit is consumed up to the price")
    void consumesRequestedCredit() {
        CreditApplication application = ledger.apply(10000, 3000, 5000);

        assertEquals(3000, application.getUsed());
        assertEquals(7000, application.getResult());
    }

    @Test
    @DisplayName("Credit never takes the price below zero")
    void creditCappedAtPrice() {
        CreditApplication application = ledger.apply(2000, 3000, 5000);

        assertEquals(2000, application.getUsed());
        assertEquals(0, application.getResult());
    }

    @Test
    @DisplayName("Requesting more than the balance is rejected")
    void creditAboveBalance() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
            () -> ledger.apply(10000, 6000, 5000));

        assertEquals("you do not have enough credit", e.getMessage());
        assertEquals("5000", e.getDetails().get("balance"));
    }

    @Test
    @DisplayName("Negative credit requests are rejected")
    void negativeCredit() {
        assertThrows(InvalidRequestException.class, () -> ledger.apply(10000, -1, 5000));
    }

    @Test
    @DisplayName("Balance of an account without credit rows is zero")
    void emptyBalance() {
        UUID accountId = UUID.randomUUID();
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), eq(accountId))).thenReturn(null);

        assertEquals(0, ledger.balanceOf(accountId));
    }

    @Test
    @DisplayName("Purchase rows are written as negative cents with their details as JSON")
    void recordPurchase() {
        UUID accountId = UUID.randomUUID();
        CreditDetails details = CreditDetails.builder()
            .reason("Purchase Math 1")
            .createdBy("webportal")
            .build();

        Credit credit = ledger.recordPurchase(accountId, 3000, details);

        assertEquals(-3000, credit.getCents());
        assertEquals(CreditType.PURCHASE, credit.getType());
        assertEquals(accountId, credit.getAccountId());

        ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
        verify(jdbcTemplate).update(anyString(), eq(credit.getId()), eq(accountId), eq(-3000L), eq("PURCHASE"),
            json.capture(), any());
        assertTrue(json.getValue().toString().contains("Purchase Math 1"));
    }

    @Test
    @DisplayName("Zero-cent ledger rows are refused")
    void zeroRows() {
        UUID accountId = UUID.randomUUID();
        CreditDetails details = CreditDetails.builder().reason("x").createdBy("y").build();

        assertThrows(IllegalArgumentException.class, () -> ledger.recordPurchase(accountId, 0, details));
        assertThrows(IllegalArgumentException.class, () -> ledger.recordReferral(accountId, 0, details));
    }
}

package io.admission.runner;

import io.admission.budget.TokenBudgetLedger;
import io.admission.gate.FifoGate;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class AdmissionTicketTest {

    @Test
    void close_returns_permit_and_commits_reservation_once() throws Exception {
        FifoGate gate = new FifoGate(2);
        TokenBudgetLedger ledger = new TokenBudgetLedger(1000);

        Optional<AdmissionTicket> ticket = AdmissionTicket.admit(0, 300, gate, ledger);
        assertTrue(ticket.isPresent());
        assertEquals(1, gate.getAvailablePermits());
        assertEquals(300, ledger.getReservedTokens());

        ticket.get().close();
        ticket.get().close();
        assertTrue(ticket.get().isClosed());
        assertEquals(2, gate.getAvailablePermits());
        assertEquals(0, ledger.getReservedTokens());
        assertEquals(300, ledger.getUsedTokens());
    }

    @Test
    void refused_reservation_gives_the_permit_back() throws Exception {
        FifoGate gate = new FifoGate(1);
        TokenBudgetLedger ledger = new TokenBudgetLedger(100);

        assertTrue(AdmissionTicket.admit(0, 500, gate, ledger).isEmpty());
        assertEquals(1, gate.getAvailablePermits());
        assertEquals(0, ledger.getActiveBatches());
    }

    @Test
    void duplicate_batch_id_is_refused() throws Exception {
        FifoGate gate = new FifoGate(2);
        TokenBudgetLedger ledger = new TokenBudgetLedger(1000);
        try (AdmissionTicket first = AdmissionTicket.admit(7, 100, gate, ledger).orElseThrow()) {
            assertEquals(7, first.batchId());
            assertTrue(AdmissionTicket.admit(7, 100, gate, ledger).isEmpty());
            assertEquals(1, gate.getAvailablePermits());
        }
        assertEquals(2, gate.getAvailablePermits());
    }
}

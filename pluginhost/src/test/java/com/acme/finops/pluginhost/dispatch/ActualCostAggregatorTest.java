package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginHostException;
import com.acme.finops.pluginhost.model.ActualCostResult;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActualCostAggregatorTest {
    private static final ResourceDescriptor DB = new ResourceDescriptor("db-1", "aws", "aws:rds/instance:Instance", null);
    private static final LocalDate D1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 2);

    private static CallOutcome<List<ActualCostResult>> ok(String plugin, ActualCostResult... rows) {
        return new CallOutcome.Success<>(plugin, List.of(rows));
    }

    @Test
    void shouldRejectMixedCurrencies() {
        ResourceResult<List<ActualCostResult>> result = new ResourceResult<>(DB, List.of(
            ok("alpha", new ActualCostResult(D1, "USD", 1.0, "")),
            ok("beta", new ActualCostResult(D2, "EUR", 2.0, ""))));

        PluginHostException e = assertThrows(PluginHostException.class, () -> ActualCostAggregator.total(result));
        assertEquals(ErrorKind.MIXED_CURRENCIES, e.kind());
        assertTrue(e.getMessage().contains("EUR, USD"));
    }

    @Test
    void shouldSumDaysWithDeclarationOrderPrecedence() throws Exception {
        ResourceResult<List<ActualCostResult>> result = new ResourceResult<>(DB, List.of(
            ok("alpha", new ActualCostResult(D1, "USD", 1.0, "a"), new ActualCostResult(D1, "USD", 0.5, "a")),
            new CallOutcome.Failure<>("gamma", ErrorKind.NO_DATA, "none"),
            ok("beta", new ActualCostResult(D1, "USD", 9.0, "b"), new ActualCostResult(D2, "USD", 2.0, "b"))));

        ActualCostTotal total = ActualCostAggregator.total(result).orElseThrow();

        assertEquals("USD", total.currency());
        assertEquals(3.5d, total.total(), 1e-9);
        assertEquals(List.of(D1, D2), total.daily().stream().map(ActualCostResult::date).toList());
        assertEquals("a", total.daily().get(0).source());
    }

    @Test
    void shouldReturnEmptyWhenNothingSucceeded() throws Exception {
        ResourceResult<List<ActualCostResult>> result = new ResourceResult<>(DB,
            List.of(new CallOutcome.Failure<>("alpha", ErrorKind.TIMEOUT, "late")));
        assertTrue(ActualCostAggregator.total(result).isEmpty());
    }
}

package org.routemap.routing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Budget Tests")
class SearchBudgetTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(SearchBudget.PROP_MAX_SETTLED);
    }

    @Test
    @DisplayName("Bound is read from the system property")
    void testDefaultsFromProperty() {
        System.setProperty(SearchBudget.PROP_MAX_SETTLED, " 25 ");
        assertEquals(25, SearchBudget.defaults().maxSettledVertices());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "lots", "0", "-3"})
    @DisplayName("Blank, invalid and non-positive values mean unbounded")
    void testUnboundedFallbacks(String raw) {
        System.setProperty(SearchBudget.PROP_MAX_SETTLED, raw);
        assertEquals(SearchBudget.UNBOUNDED, SearchBudget.defaults().maxSettledVertices());
    }

    @Test
    @DisplayName("Unset property means unbounded")
    void testUnset() {
        assertEquals(SearchBudget.UNBOUNDED, SearchBudget.defaults().maxSettledVertices());
    }

    @Test
    @DisplayName("Check passes up to the bound and fails beyond it")
    void testCheck() {
        SearchBudget budget = SearchBudget.of(3);
        assertDoesNotThrow(() -> budget.checkSettledVertices(3));
        RoutingException ex = assertThrows(RoutingException.class, () -> budget.checkSettledVertices(4));
        assertEquals(RoutingException.Reason.BUDGET_SETTLED_EXCEEDED, ex.reason());
    }

    @Test
    @DisplayName("Failures carry a reason and a readable message")
    void testReasonContract() {
        RoutingException ex = new RoutingException(RoutingException.Reason.UNREACHABLE, "no route to 7");
        assertEquals(RoutingException.Reason.UNREACHABLE, ex.reason());
        assertEquals("UNREACHABLE: no route to 7", ex.getMessage());
        assertThrows(NullPointerException.class, () -> new RoutingException(null, "message"));
    }
}

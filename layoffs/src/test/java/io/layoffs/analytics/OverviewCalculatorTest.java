package io.layoffs.analytics;

import io.layoffs.model.LayoffRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static io.layoffs.model.LayoffFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

class OverviewCalculatorTest {
    private static LayoffRecord shutdown(String company, Integer total, String funds) {
        return LayoffRecord.builder(1).company(company).totalLaidOff(total).percentageLaidOff(1.0)
                .fundsRaised(funds == null ? null : new BigDecimal(funds))
                .date(LocalDate.of(2022, 5, 1)).build();
    }

    @Test
    void reports_extremes_and_date_range() {
        DatasetOverview o = new OverviewCalculator().overview(List.of(
                event(1, "A", "Tech", 12000, 0.06, LocalDate.of(2023, 1, 20)),
                event(2, "B", "Tech", null, 0.5, LocalDate.of(2020, 3, 11)),
                event(3, "C", "Tech", 80, null, null)));

        assertEquals(3, o.events());
        assertEquals(12000, o.maxTotalLaidOff());
        assertEquals(0.5, o.maxPercentageLaidOff());
        assertEquals(LocalDate.of(2020, 3, 11), o.firstDate());
        assertEquals(LocalDate.of(2023, 1, 20), o.lastDate());
        assertTrue(o.fullShutdowns().isEmpty());
    }

    @Test
    void full_shutdowns_are_listed_most_funded_first() {
        DatasetOverview o = new OverviewCalculator().overview(List.of(
                shutdown("Quibi", null, "1800"),
                shutdown("Nameless", 20, null),
                shutdown("Britishvolt", 206, "2400"),
                event(4, "Partial", "Tech", 10, 0.99, null)));

        assertEquals(List.of("Britishvolt", "Quibi", "Nameless"),
                o.fullShutdowns().stream().map(DatasetOverview.FullShutdown::company).toList());
        assertEquals(new BigDecimal("2400"), o.fullShutdowns().get(0).fundsRaised());
        assertEquals(1.0, o.maxPercentageLaidOff());
    }

    @Test
    void empty_dataset_has_no_figures() {
        DatasetOverview o = new OverviewCalculator().overview(List.of());
        assertEquals(0, o.events());
        assertNull(o.maxTotalLaidOff());
        assertNull(o.firstDate());
    }
}

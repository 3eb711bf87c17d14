package com.workpipe.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WorkItemTest {

    @Test
    void retryLabelCarriesAttemptAndKeepsKey() {
        WorkItem first = WorkItem.first(7);
        WorkItem retry = first.retry(3);

        assertEquals("Item #7", first.label);
        assertEquals("Item #7 (retry 3)", retry.label);
        assertEquals(3, retry.attempt);
        assertEquals(first.key(), retry.key());
    }

    @Test
    void retryOfRetryDoesNotStackSuffixes() {
        WorkItem twice = WorkItem.first(1).retry(1).retry(2);
        assertEquals("Item #1 (retry 2)", twice.label);
    }

    @Test
    void normalizeIsIdempotent() {
        String[] labels = {
                "Item #1", "Item #1 (retry 1)", "Item #12 (retry 9) (retry 10)",
                "something else", "", "(retry 1)", "Item #3 (retry x)"
        };
        for (String label : labels) {
            String once = WorkItem.normalize(label);
            assertEquals(once, WorkItem.normalize(once), label);
        }
    }

    @Test
    void normalizeStripsAnyRetrySuffix() {
        for (int k = 1; k <= 50; k++) {
            assertEquals("Item #4", WorkItem.normalize("Item #4 (retry " + k + ")"));
        }
        assertEquals("Item #4", WorkItem.normalize("Item #4"));
        assertEquals("Item #3 (retry x)", WorkItem.normalize("Item #3 (retry x)"));
    }

    @Test
    void rejectsNonPositiveRetryAttempt() {
        assertThrows(IllegalArgumentException.class, () -> WorkItem.first(1).retry(0));
    }
}

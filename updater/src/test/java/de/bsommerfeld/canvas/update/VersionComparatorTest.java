package de.bsommerfeld.canvas.update;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionComparatorTest {

    @Test
    void compare_shouldOrderNumerically() {
        assertTrue(VersionComparator.INSTANCE.compare("5.3.10", "5.3.9") > 0);
        assertTrue(VersionComparator.INSTANCE.compare("4.9.9", "5.0.0") < 0);
    }

    @Test
    void compare_shouldTreatMissingSegmentsAsZero() {
        assertEquals(0, VersionComparator.INSTANCE.compare("1.2", "1.2.0"));
    }

    @Test
    void isNewer_shouldTreatUnknownCurrentAsOldest() {
        assertTrue(VersionComparator.isNewer("0.0.1", "unknown"));
        assertFalse(VersionComparator.isNewer("1.0.0", "1.0.0"));
    }
}

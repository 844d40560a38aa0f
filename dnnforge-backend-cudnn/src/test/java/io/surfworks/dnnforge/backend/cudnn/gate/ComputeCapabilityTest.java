package io.surfworks.dnnforge.backend.cudnn.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.dnnforge.core.graph.ConfigurationException;

@DisplayName("ComputeCapability")
class ComputeCapabilityTest {

    @Test
    @DisplayName("parses the sm_XY and dotted forms")
    void parses() {
        assertEquals(new ComputeCapability(3, 5), ComputeCapability.parse("sm_35"));
        assertEquals(new ComputeCapability(8, 6), ComputeCapability.parse(" 8.6 "));
        assertEquals(new ComputeCapability(10, 0), ComputeCapability.parse("10.0"));
    }

    @Test
    @DisplayName("the last digit of sm_XYZ is the minor version")
    void multiDigitMajor() {
        assertEquals(new ComputeCapability(9, 0), ComputeCapability.parse("sm_90"));
        assertEquals(new ComputeCapability(10, 0), ComputeCapability.parse("sm_100"));
        assertEquals(new ComputeCapability(12, 0), ComputeCapability.parse("sm_120"));
        assertTrue(ComputeCapability.parse("sm_100").isAtLeast(AvailabilityGate.MINIMUM_CAPABILITY));
    }

    @Test
    @DisplayName("orders by major then minor")
    void ordering() {
        ComputeCapability kepler = ComputeCapability.parse("3.0");

        assertTrue(ComputeCapability.parse("3.5").isAtLeast(kepler));
        assertTrue(kepler.isAtLeast(kepler));
        assertFalse(ComputeCapability.parse("2.1").isAtLeast(kepler));
        assertTrue(ComputeCapability.parse("7.0").compareTo(ComputeCapability.parse("6.9")) > 0);
    }

    @Test
    @DisplayName("rejects anything else")
    void rejects() {
        assertThrows(ConfigurationException.class, () -> ComputeCapability.parse("kepler"));
        assertThrows(ConfigurationException.class, () -> ComputeCapability.parse(null));
        assertThrows(ConfigurationException.class, () -> ComputeCapability.parse("sm_"));
    }
}

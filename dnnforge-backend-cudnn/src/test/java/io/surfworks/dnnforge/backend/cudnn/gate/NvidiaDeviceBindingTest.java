package io.surfworks.dnnforge.backend.cudnn.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NvidiaDeviceBinding")
class NvidiaDeviceBindingTest {

    @Test
    @DisplayName("one nvidia-smi run answers both device queries")
    void queriesOnce() {
        List<List<String>> commands = new ArrayList<>();
        NvidiaDeviceBinding binding = new NvidiaDeviceBinding(1, command -> {
            commands.add(command);
            return List.of("8.6");
        });

        assertEquals("cuda1", binding.activeDevice());
        assertEquals("8.6", binding.computeCapability());
        assertEquals("cuda1", binding.activeDevice());

        assertEquals(1, commands.size());
        assertEquals(List.of("nvidia-smi", "--query-gpu=compute_cap", "--format=csv,noheader", "-i", "1"),
                commands.get(0));
    }

    @Test
    @DisplayName("no listed GPU means a cpu device")
    void noGpu() {
        NvidiaDeviceBinding binding = new NvidiaDeviceBinding(0,
                command -> List.of("No devices were found"));

        assertEquals("cpu", binding.activeDevice());
        assertEquals("", binding.computeCapability());
    }

    @Test
    @DisplayName("skips blank and non-numeric lines")
    void parsesFirstCapabilityLine() {
        assertEquals("7.5", NvidiaDeviceBinding.parseCapabilityLine(List.of("", "  ", "warning: x", " 7.5 ", "8.0")));
        assertEquals("", NvidiaDeviceBinding.parseCapabilityLine(List.of()));
    }
}

package org.mediaroom.server.recording;

import org.junit.jupiter.api.Test;
import org.mediaroom.client.MediaRoomException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapturePortAllocatorTest {

    private final Set<Integer> busy = new HashSet<>();

    private CapturePortAllocator allocator(int min, int max) {
        return new CapturePortAllocator("127.0.0.1", min, max) {
            @Override
            protected boolean isFree(int port) {
                return !busy.contains(port);
            }
        };
    }

    @Test
    void handsOutDistinctEvenPorts() {
        CapturePortAllocator allocator = allocator(40001, 40020);

        List<Integer> ports = allocator.allocate(3);

        assertThat(ports).containsExactly(40002, 40004, 40006);
        assertThat(allocator.allocate(1)).containsExactly(40008);
        assertThat(allocator.getReservedCount()).isEqualTo(4);
    }

    @Test
    void skipsPortsInUse() {
        busy.add(40003);
        CapturePortAllocator allocator = allocator(40000, 40020);

        assertThat(allocator.allocate(2)).containsExactly(40000, 40004);
    }

    @Test
    void exhaustionReleasesPartialAllocation() {
        CapturePortAllocator allocator = allocator(40000, 40007);
        allocator.allocate(3);

        assertThatThrownBy(() -> allocator.allocate(2)).isInstanceOf(MediaRoomException.class);
        assertThat(allocator.getReservedCount()).isEqualTo(3);
    }

    @Test
    void releasedPortsCanBeReused() {
        CapturePortAllocator allocator = allocator(40000, 40003);
        List<Integer> first = allocator.allocate(2);

        allocator.release(first);

        assertThat(allocator.allocate(2)).containsExactlyInAnyOrderElementsOf(Arrays.asList(40000, 40002));
    }

    @Test
    void rejectsInvalidRange() {
        assertThatThrownBy(() -> allocator(40000, 40000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> allocator(0, 40000)).isInstanceOf(IllegalArgumentException.class);
    }
}

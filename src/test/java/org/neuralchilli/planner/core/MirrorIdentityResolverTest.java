package org.neuralchilli.planner.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.store.InMemoryBlockStore;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.planner.BlockFixtures.*;

class MirrorIdentityResolverTest {

    private InMemoryBlockStore store;
    private MirrorIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryBlockStore();
        resolver = new MirrorIdentityResolver(store);
    }

    @Test
    void shouldResolvePlainBlockToItself() {
        store.put(task(10));

        assertThat(resolver.canonicalId(10)).isEqualTo(TaskId.of(10));
    }

    @Test
    void shouldResolveUnknownIdToItself() {
        assertThat(resolver.canonicalId(12345)).isEqualTo(TaskId.of(12345));
    }

    @Test
    void shouldResolveMirrorToSource() {
        store.put(task(10));
        store.put(mirror(11, 10, true));

        assertThat(resolver.canonicalId(11)).isEqualTo(TaskId.of(10));
    }

    @Test
    void shouldFollowMirrorChains() {
        store.put(task(10));
        store.put(mirror(11, 10, false));
        store.put(mirror(12, 11, false));

        assertThat(resolver.canonicalId(12)).isEqualTo(TaskId.of(10));
    }

    @Test
    void shouldStopOnMirrorCycle() {
        // Given: Two blocks mirroring each other
        store.put(mirror(21, 20, false));
        store.put(mirror(20, 21, false));
        store.put(mirror(22, 21, false));

        // Then: Every member and every block leading into the cycle resolve alike
        assertThat(resolver.canonicalId(20)).isEqualTo(TaskId.of(20));
        assertThat(resolver.canonicalId(21)).isEqualTo(TaskId.of(20));
        assertThat(resolver.canonicalId(22)).isEqualTo(TaskId.of(20));
    }

    @Test
    void shouldFallBackToWorkingSet() {
        // Given: The store knows neither block, the fetched set knows the mirror
        Block fetchedMirror = mirror(31, 30, true);
        IdentityResolver withFetched = resolver.withWorkingSet(Map.of(31L, fetchedMirror));

        assertThat(withFetched.canonicalId(31)).isEqualTo(TaskId.of(30));
        assertThat(resolver.canonicalId(31)).isEqualTo(TaskId.of(31));
    }

    @Test
    void shouldPreferLiveStateOverWorkingSet() {
        // Given: The fetched copy is a mirror but the live block no longer is
        store.put(task(31));
        IdentityResolver withFetched = resolver.withWorkingSet(Map.of(31L, mirror(31, 30, true)));

        assertThat(withFetched.canonicalId(31)).isEqualTo(TaskId.of(31));
    }
}

package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.core.test.MockResource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class DependencyGraphTest {

    @Test
    public void testReverseEdgesAndNodeForEveryResource() {
        ResourceStore store = new ResourceStore();
        store.insert("M", MockResource.primitive("M"));
        store.insert("P", new MockResource("P").dependsOn("M"));
        store.insert("E", new MockResource("E").dependsOn("P", "M"));
        store.insert("Lonely", new MockResource("Lonely"));

        DependencyGraph graph = DependencyGraph.rebuild(store);

        Assertions.assertEquals(4, graph.size());
        Assertions.assertEquals(Set.of("P", "E"), graph.getUsedBy("M"));
        Assertions.assertEquals(Set.of("E"), graph.getUsedBy("P"));
        Assertions.assertTrue(graph.getUsedBy("E").isEmpty());
        Assertions.assertTrue(graph.getUsedBy("Lonely").isEmpty());
    }

    @Test
    public void testDanglingDependencyIsSkipped() {
        ResourceStore store = new ResourceStore();
        store.insert("P", new MockResource("P").dependsOn("Gone"));

        DependencyGraph graph = DependencyGraph.rebuild(store);

        Assertions.assertTrue(graph.hasNode("P"));
        Assertions.assertFalse(graph.hasNode("Gone"));
        Assertions.assertNull(graph.findUsedBy("Gone"));
    }

    @Test
    public void testCycleTerminates() {
        ResourceStore store = new ResourceStore();
        store.insert("A", new MockResource("A").dependsOn("B"));
        store.insert("B", new MockResource("B").dependsOn("A"));

        DependencyGraph graph = DependencyGraph.rebuild(store);

        Assertions.assertEquals(Set.of("B"), graph.getUsedBy("A"));
        Assertions.assertEquals(Set.of("A"), graph.getUsedBy("B"));
    }

    @Test
    public void testRebuildIsIdempotent() {
        ResourceStore store = new ResourceStore();
        store.insert("A", new MockResource("A"));
        store.insert("B", new MockResource("B").dependsOn("A"));
        store.insert("C", new MockResource("C").dependsOn("A", "B"));

        DependencyGraph first = DependencyGraph.rebuild(store);
        DependencyGraph second = DependencyGraph.rebuild(store);

        Assertions.assertEquals(first.nodes(), second.nodes());
        for (String id : first.nodes()) {
            Assertions.assertEquals(first.getUsedBy(id), second.getUsedBy(id), id);
        }
    }

    @Test
    public void testMissingNodeForTrackedResourceIsFatal() {
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> DependencyGraph.empty().getUsedBy("P"));
        Assertions.assertTrue(e.getMessage().contains("P"));
    }
}

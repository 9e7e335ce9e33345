package com.agentite.scene.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Prefab trees.
 */
class PrefabTest {

    @Test
    void testAddChildSetsParent() {
        Prefab root = new Prefab("Root");
        Prefab child = new Prefab("Child");

        root.addChild(child);

        assertThat(child.getParent()).isSameAs(root);
        assertThat(root.getChildren()).containsExactly(child);
    }

    @Test
    void testChildCannotBeSharedBetweenParents() {
        Prefab first = new Prefab("First");
        Prefab second = new Prefab("Second");
        Prefab child = new Prefab("Child");
        first.addChild(child);

        assertThatThrownBy(() -> second.addChild(child))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> first.addChild(first))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(second.getChildCount()).isZero();
    }

    @Test
    void testLimitsAreEnforced() {
        Prefab prefab = new Prefab("Full");
        for (int i = 0; i < Prefab.MAX_COMPONENTS; i++) {
            prefab.addComponent(ComponentConfig.shorthand("C" + i, PropValue.ofInt(i)));
        }
        for (int i = 0; i < Prefab.MAX_CHILDREN; i++) {
            prefab.addChild(new Prefab("Child" + i));
        }

        assertThatThrownBy(() -> prefab.addComponent(new ComponentConfig("Extra")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> prefab.addChild(new Prefab("Extra")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testVisitorWalksDepthFirst() {
        Prefab root = new Prefab("Root");
        Prefab a = new Prefab("A");
        Prefab b = new Prefab("B");
        a.addChild(new Prefab("A1"));
        root.addChild(a);
        root.addChild(b);
        root.addComponent(ComponentConfig.shorthand("Health", PropValue.ofInt(5)));
        a.addComponent(new ComponentConfig("Tag"));

        List<String> order = new ArrayList<>();
        root.accept(p -> order.add(p.getName()));

        assertThat(order).containsExactly("Root", "A", "A1", "B");
        assertThat(root.countEntities()).isEqualTo(4);
        assertThat(root.countComponents()).isEqualTo(2);
    }

    @Test
    void testHasOffset() {
        Prefab prefab = new Prefab();
        assertThat(prefab.hasOffset()).isFalse();

        prefab.setOffset(0, -1.5f);
        assertThat(prefab.hasOffset()).isTrue();
    }

    @Test
    void testComponentLookup() {
        Prefab prefab = new Prefab("P");
        ComponentConfig stats = new ComponentConfig("Stats");
        stats.addField("strength", PropValue.ofInt(10));
        prefab.addComponent(stats);

        assertThat(prefab.findComponent("Stats")).contains(stats);
        assertThat(prefab.findComponent("Missing")).isEmpty();
        assertThat(stats.isShorthand()).isFalse();
        assertThat(ComponentConfig.shorthand("Health", PropValue.ofInt(1)).isShorthand()).isTrue();
    }

    @Test
    void testVectorValues() {
        PropValue value = PropValue.ofVector(1f, 2f, 3f);

        assertThat(value.getType()).isEqualTo(PropType.VEC3);
        assertThat(value.vectorSize()).isEqualTo(3);
        assertThat(value).isEqualTo(PropValue.ofVector(1f, 2f, 3f));
        assertThatThrownBy(() -> PropValue.ofVector(1f))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PropValue.ofVector(1f, 2f, 3f, 4f, 5f))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.agentite.scene.parser;

import com.agentite.scene.TestComponents;
import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.model.PropType;
import com.agentite.scene.model.PropValue;
import com.agentite.scene.model.SceneDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PrefabParser.
 */
class PrefabParserTest {

    @Test
    void testParseSimpleEntity() {
        String source = """
                Player @(100, 200) {
                    TestHealth: { current: 80, max: 100 }
                }
                """;

        Prefab prefab = PrefabParser.parsePrefab(source, "player.prefab");

        assertThat(prefab.getName()).isEqualTo("Player");
        assertThat(prefab.getOffsetX()).isEqualTo(100.0f);
        assertThat(prefab.getOffsetY()).isEqualTo(200.0f);
        assertThat(prefab.getComponentCount()).isEqualTo(1);

        ComponentConfig health = prefab.getComponents().get(0);
        assertThat(health.getComponentName()).isEqualTo("TestHealth");
        assertThat(health.getFieldCount()).isEqualTo(2);
        assertThat(health.findField("current")).contains(PropValue.ofInt(80));
        assertThat(health.findField("max")).contains(PropValue.ofInt(100));
    }

    @Test
    void testScalarShorthandValues() {
        String source = """
                Player {
                    Health: 100
                    Speed: 5.5
                    Visible: true
                    Name: "Player One"
                    State: idle
                }
                """;

        Prefab prefab = PrefabParser.parsePrefab(source, null);

        assertThat(prefab.getComponents()).hasSize(5).allMatch(ComponentConfig::isShorthand);
        assertThat(value(prefab, 0)).isEqualTo(PropValue.ofInt(100));
        assertThat(value(prefab, 1)).isEqualTo(PropValue.ofFloat(5.5));
        assertThat(value(prefab, 2)).isEqualTo(PropValue.ofBool(true));
        assertThat(value(prefab, 3)).isEqualTo(PropValue.ofString("Player One"));
        assertThat(value(prefab, 4).getType()).isEqualTo(PropType.IDENTIFIER);
        assertThat(value(prefab, 4).getText()).isEqualTo("idle");
    }

    @Test
    void testVectorValues() {
        String source = """
                Thing {
                    A: (10, 20)
                    B: (1.5, -2.5, 0)
                    C: (1.0, 0.5, 0.25, 1.0)
                }
                """;

        Prefab prefab = PrefabParser.parsePrefab(source, null);

        assertThat(value(prefab, 0).getType()).isEqualTo(PropType.VEC2);
        assertThat(value(prefab, 0).getVector()).containsExactly(10f, 20f);
        assertThat(value(prefab, 1).getType()).isEqualTo(PropType.VEC3);
        assertThat(value(prefab, 1).getVector()).containsExactly(1.5f, -2.5f, 0f);
        assertThat(value(prefab, 2).getType()).isEqualTo(PropType.VEC4);
        assertThat(value(prefab, 2).component(3)).isEqualTo(1.0f);
    }

    @ParameterizedTest
    @ValueSource(strings = { "(1)", "(1, 2, 3, 4, 5)", "(1, 2", "(1, x)" })
    void testMalformedVectorsAreErrors(String vector) {
        String source = "Thing { A: " + vector + " }";

        assertThatThrownBy(() -> PrefabParser.parsePrefab(source, null))
                .isInstanceOf(SceneParseException.class);
    }

    @Test
    void testTooManyVectorComponentsMessage() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("T { A: (1,2,3,4,5) }", "v.prefab"))
                .isInstanceOf(SceneParseException.class)
                .hasMessageContaining("v.prefab:1:")
                .hasMessageContaining("Vector has too many components (max 4)");
    }

    @ParameterizedTest
    @ValueSource(strings = { "A { V: (1e39, 0) }", "A @(0, -1e39) { }", "A { S: 1e999 }" })
    void testNumbersBeyondFloatRangeAreErrors(String source) {
        assertThatThrownBy(() -> PrefabParser.parsePrefab(source, null))
                .isInstanceOf(SceneParseException.class)
                .hasMessageContaining("out of");
    }

    @Test
    void testNestedEntitiesWithoutKeyword() {
        String source = """
                Player {
                    TestHealth: { current: 100, max: 100 }

                    Weapon @(20, 0) {
                        TestSprite: { texture_path: "sword.png" }
                    }
                    Shield @(-15, 0) {
                    }
                }
                """;

        Prefab prefab = PrefabParser.parsePrefab(source, null);

        assertThat(prefab.getChildCount()).isEqualTo(2);
        assertThat(prefab.getChildren()).extracting(Prefab::getName).containsExactly("Weapon", "Shield");
        assertThat(prefab.getChildren().get(0).getOffsetX()).isEqualTo(20f);
        assertThat(prefab.getChildren().get(1).getOffsetX()).isEqualTo(-15f);
        assertThat(prefab.getChildren().get(0).getParent()).isSameAs(prefab);
    }

    @Test
    void testEntityKeywordIsOptional() {
        String withKeyword = """
                Entity Player @(1, 2) {
                    Health: 10
                    Entity Weapon @(5, 0) {
                        Damage: 3
                    }
                    Entity {
                        Tag: {}
                    }
                }
                """;
        String withoutKeyword = """
                Player @(1, 2) {
                    Health: 10
                    Weapon @(5, 0) {
                        Damage: 3
                    }
                    {
                        Tag: {}
                    }
                }
                """;

        assertThat(PrefabParser.parsePrefab(withKeyword, null))
                .isEqualTo(PrefabParser.parsePrefab(withoutKeyword, null));
    }

    @Test
    void testQuotedNameAndAnonymousEntity() {
        Prefab named = PrefabParser.parsePrefab("\"Big Boss\" @(3, 4) { }", null);
        Prefab anonymous = PrefabParser.parsePrefab("Entity @(3, 4) { }", null);

        assertThat(named.getName()).isEqualTo("Big Boss");
        assertThat(anonymous.getName()).isNull();
        assertThat(anonymous.getOffsetY()).isEqualTo(4f);
    }

    @Test
    void testBasePrefabReference() {
        Prefab prefab = PrefabParser.parsePrefab("""
                Goblin {
                    prefab: "enemies/base_enemy.prefab"
                    TestHealth: { current: 30 }
                }
                """, null);

        assertThat(prefab.getBasePrefab()).isEqualTo("enemies/base_enemy.prefab");
        assertThat(prefab.getComponentCount()).isEqualTo(1);
    }

    @Test
    void testBasePrefabRequiresString() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("A { prefab: base }", null))
                .hasMessageContaining("Expected string path after 'prefab:'");
    }

    @Test
    void testFieldsWithoutCommas() {
        Prefab prefab = PrefabParser.parsePrefab("""
                A {
                    TestStats: {
                        strength: 10
                        defense: 5,
                        speed: 1.5
                    }
                }
                """, null);

        assertThat(prefab.getComponents().get(0).getFieldCount()).isEqualTo(3);
    }

    @Test
    void testCommentsAreIgnored() {
        Prefab prefab = PrefabParser.parsePrefab("""
                # A hash comment
                Player { // trailing
                    // Health: 1
                    Health: 2 # another
                }
                """, null);

        assertThat(prefab.getComponentCount()).isEqualTo(1);
        assertThat(value(prefab, 0)).isEqualTo(PropValue.ofInt(2));
    }

    @Test
    void testTooManyComponents() {
        StringBuilder sb = new StringBuilder("A {\n");
        for (int i = 0; i <= Prefab.MAX_COMPONENTS; i++) {
            sb.append("  C").append(i).append(": 1\n");
        }
        sb.append("}\n");

        assertThatThrownBy(() -> PrefabParser.parsePrefab(sb.toString(), null))
                .isInstanceOf(SceneParseException.class)
                .hasMessageContaining("Too many components");
    }

    @Test
    void testTooManyFields() {
        StringBuilder sb = new StringBuilder("A { C: {");
        for (int i = 0; i <= ComponentConfig.MAX_FIELDS; i++) {
            sb.append(" f").append(i).append(": 1");
        }
        sb.append(" } }");

        assertThatThrownBy(() -> PrefabParser.parsePrefab(sb.toString(), null))
                .hasMessageContaining("Too many fields in component");
    }

    @Test
    void testTooManyChildren() {
        StringBuilder sb = new StringBuilder("A {\n");
        for (int i = 0; i <= Prefab.MAX_CHILDREN; i++) {
            sb.append("  Child").append(i).append(" { }\n");
        }
        sb.append("}\n");

        assertThatThrownBy(() -> PrefabParser.parsePrefab(sb.toString(), null))
                .hasMessageContaining("Too many child entities");
    }

    @Test
    void testErrorsReportLocationAndRecordLastError() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("Player {\n  Health 5\n}", "p.prefab"))
                .isInstanceOf(SceneParseException.class)
                .hasMessageStartingWith("p.prefab:2:");

        assertThat(ParseErrors.lastError()).startsWith("p.prefab:2:");

        PrefabParser.parsePrefab("Ok { }", null);
        assertThat(ParseErrors.lastError()).isNull();
    }

    @Test
    void testMissingClosingBrace() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("Player { Health: 5", null))
                .hasMessageContaining("Expected '}' after entity body");
    }

    @Test
    void testEmptySourceIsError() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("", null))
                .isInstanceOf(SceneParseException.class);
        assertThatThrownBy(() -> PrefabParser.parseScene("  // nothing here\n", "empty.scene"))
                .hasMessageContaining("No entities found in 'empty.scene'");
    }

    @Test
    void testLexicalErrorAbortsParse() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("Player { Name: \"unterminated }", "x"))
                .hasMessageContaining("Unterminated string");
    }

    @Test
    void testTrailingContentAfterPrefabIsError() {
        assertThatThrownBy(() -> PrefabParser.parsePrefab("A { } B { }", null))
                .hasMessageContaining("Unexpected content after entity");
    }

    @Test
    void testParseSceneWithSeveralRoots() {
        String source = """
                Player @(100, 100) {
                    TestHealth: { current: 100, max: 100 }
                }

                Entity Enemy @(300, 100) {
                    TestSprite: { texture_path: "enemies/goblin.png" }
                    Minion { }
                }
                """;

        List<Prefab> roots = PrefabParser.parseScene(source, "level.scene");

        assertThat(roots).extracting(Prefab::getName).containsExactly("Player", "Enemy");
        assertThat(roots.get(1).getChildCount()).isEqualTo(1);
    }

    @Test
    void testInvalidSceneSyntax() {
        assertThatThrownBy(() -> PrefabParser.parseScene("{ not a valid scene }", "bad.scene"))
                .isInstanceOf(SceneParseException.class)
                .hasMessageContaining("Expected entity name or 'Entity' keyword");
    }

    @Test
    void testUnknownComponentsAreReportedWhenValidating() {
        SceneDiagnostics diagnostics = new SceneDiagnostics();

        Prefab prefab = PrefabParser.parsePrefab("""
                A {
                    TestHealth: { current: 1 }
                    Mystery: 3
                }
                """, "a.prefab", TestComponents.registry(), diagnostics);

        assertThat(prefab.getComponentCount()).isEqualTo(2);
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0))
                .contains("a.prefab:3:5")
                .contains("Unknown component 'Mystery'");
    }

    private static PropValue value(Prefab prefab, int component) {
        return prefab.getComponents().get(component).getFields().get(0).getValue();
    }
}

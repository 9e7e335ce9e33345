package com.agentite.scene.writer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentite.scene.model.ComponentConfig;
import com.agentite.scene.model.FieldAssign;
import com.agentite.scene.model.Prefab;
import com.agentite.scene.model.PropType;
import com.agentite.scene.model.PropValue;
import com.agentite.scene.parser.PrefabParser;
import com.agentite.scene.parser.SceneLexer;

/**
 * Renders prefab trees back to definition source.
 *
 * Output re-parses to an equal tree: headers use the keyword-free form, a single {@code value}
 * field uses the scalar shorthand, NULL fields are dropped, strings are escaped and integral floats keep a decimal point
 * so they stay floats.
 */
public class SceneWriter {
    private static final Logger log = LoggerFactory.getLogger(SceneWriter.class);

    static final String INDENT = "    ";

    public String write(Prefab prefab) {
        StringBuilder sb = new StringBuilder();
        writeEntity(sb, prefab, 0);
        return sb.toString();
    }

    /**
     * Render several root entities separated by blank lines.
     */
    public String write(List<Prefab> roots) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < roots.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            writeEntity(sb, roots.get(i), 0);
        }
        return sb.toString();
    }

    public void writeFile(Prefab prefab, Path path) throws IOException {
        Files.writeString(path, write(prefab), StandardCharsets.UTF_8);
        log.info("Wrote prefab to {}", path);
    }

    public void writeFile(List<Prefab> roots, Path path) throws IOException {
        Files.writeString(path, write(roots), StandardCharsets.UTF_8);
        log.info("Wrote {} root entities to {}", roots.size(), path);
    }

    private void writeEntity(StringBuilder sb, Prefab prefab, int depth) {
        indent(sb, depth);
        writeHeader(sb, prefab);
        sb.append(" {\n");

        boolean hasBody = false;
        if (prefab.getBasePrefab() != null) {
            indent(sb, depth + 1);
            sb.append(PrefabParser.PREFAB_KEYWORD).append(": ").append(quote(prefab.getBasePrefab())).append('\n');
            hasBody = true;
        }

        for (ComponentConfig component : prefab.getComponents()) {
            writeComponent(sb, component, depth + 1);
            hasBody = true;
        }

        if (hasBody && prefab.getChildCount() > 0) {
            sb.append('\n');
        }

        for (Prefab child : prefab.getChildren()) {
            writeEntity(sb, child, depth + 1);
        }

        indent(sb, depth);
        sb.append("}\n");
    }

    private void writeHeader(StringBuilder sb, Prefab prefab) {
        String name = prefab.getName();
        if (name == null) {
            sb.append(PrefabParser.ENTITY_KEYWORD);
        } else if (name.equals(PrefabParser.ENTITY_KEYWORD)) {
            sb.append(PrefabParser.ENTITY_KEYWORD).append(' ').append(name);
        } else if (SceneLexer.isIdentifier(name)) {
            sb.append(name);
        } else {
            sb.append(quote(name));
        }

        if (prefab.hasOffset()) {
            sb.append(" @(")
                    .append(formatCompact(prefab.getOffsetX()))
                    .append(", ")
                    .append(formatCompact(prefab.getOffsetY()))
                    .append(')');
        }
    }

    private void writeComponent(StringBuilder sb, ComponentConfig component, int depth) {
        indent(sb, depth);
        sb.append(component.getComponentName()).append(": ");

        // Null has no literal form, so null fields are left out.
        List<FieldAssign> fields = component.getFields().stream()
                .filter(field -> field.getValue().getType() != PropType.NULL)
                .toList();

        if (fields.isEmpty()) {
            sb.append("{}\n");
            return;
        }
        if (component.isShorthand()) {
            sb.append(formatValue(fields.get(0).getValue())).append('\n');
            return;
        }

        sb.append("{\n");
        for (FieldAssign field : fields) {
            indent(sb, depth + 1);
            sb.append(field.getName()).append(": ").append(formatValue(field.getValue())).append('\n');
        }
        indent(sb, depth);
        sb.append("}\n");
    }

    /**
     * Source form of a literal value. {@code null} is written for NULL but reads back as an
     * identifier; entity writes never emit it.
     */
    public static String formatValue(PropValue value) {
        return switch (value.getType()) {
            case NULL -> "null";
            case INT -> Long.toString(value.getIntValue());
            case FLOAT -> formatFloat(value.getFloatValue());
            case BOOL -> Boolean.toString(value.isBoolValue());
            case STRING -> quote(value.getText());
            case IDENTIFIER -> SceneLexer.isIdentifier(value.getText()) ? value.getText() : quote(value.getText());
            case VEC2, VEC3, VEC4 -> formatVector(value);
        };
    }

    /**
     * Integral values below 1e9 get one decimal place; others the shortest exact form.
     */
    static String formatFloat(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e9) {
            return String.format(Locale.ROOT, "%.1f", value);
        }
        return Double.toString(value);
    }

    static String formatCompact(float value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e9f) {
            return Long.toString((long) value);
        }
        return Float.toString(value);
    }

    private static String formatVector(PropValue value) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < value.vectorSize(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(formatCompact(value.component(i)));
        }
        return sb.append(')').toString();
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static void indent(StringBuilder sb, int depth) {
        sb.append(INDENT.repeat(depth));
    }
}

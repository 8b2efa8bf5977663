package org.fortranonjava;

import org.fortranonjava.core.FortranCompilerException;
import org.fortranonjava.core.IntrinsicTypeDefaultKinds;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Options that control one compiled unit.
 * <p>
 * Options may be set directly or loaded from a YAML document such as:
 * <pre>
 * debugEnabled: true
 * fileName: main.f90
 * warningsAsErrors: false
 * defaultKinds:
 *   integer: 8
 *   real: 8
 * </pre>
 */
public class CompilerOptions implements Cloneable {
    public boolean debugEnabled = false;
    public boolean warningsAsErrors = false;
    public boolean pruneDoTerminatorLabels = true;
    public String fileName = null;
    public IntrinsicTypeDefaultKinds defaultKinds = new IntrinsicTypeDefaultKinds();

    /**
     * Loads options from a YAML document. Unknown keys are rejected.
     *
     * @param yaml the YAML text
     * @return the options, with defaults for absent keys
     */
    public static CompilerOptions fromYaml(String yaml) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .setLabel("compiler options")
                .build();
        Load load = new Load(settings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new FortranCompilerException("compiler options", "Malformed options document", e);
        }
        return fromMap(document);
    }

    public static CompilerOptions fromYaml(InputStream in, String sourceName) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .setLabel(sourceName)
                .build();
        try (in) {
            return fromMap(new Load(settings).loadFromInputStream(in));
        } catch (IOException | YamlEngineException e) {
            throw new FortranCompilerException(sourceName, "Cannot read options", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static CompilerOptions fromMap(Object document) {
        CompilerOptions options = new CompilerOptions();
        if (document == null) {
            return options;
        }
        if (!(document instanceof Map)) {
            throw new FortranCompilerException("Options document must be a mapping");
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) document).entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "debugEnabled" -> options.debugEnabled = asBoolean(entry.getKey(), value);
                case "warningsAsErrors" -> options.warningsAsErrors = asBoolean(entry.getKey(), value);
                case "pruneDoTerminatorLabels" -> options.pruneDoTerminatorLabels = asBoolean(entry.getKey(), value);
                case "fileName" -> options.fileName = value == null ? null : value.toString();
                case "defaultKinds" -> applyDefaultKinds(options.defaultKinds, value);
                default -> throw new FortranCompilerException("Unknown option '" + entry.getKey() + "'");
            }
        }
        return options;
    }

    @SuppressWarnings("unchecked")
    private static void applyDefaultKinds(IntrinsicTypeDefaultKinds kinds, Object value) {
        if (!(value instanceof Map)) {
            throw new FortranCompilerException("Option 'defaultKinds' must be a mapping");
        }
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            int kind = asInt("defaultKinds." + entry.getKey(), entry.getValue());
            switch (entry.getKey()) {
                case "integer" -> kinds.setDefaultIntegerKind(kind);
                case "real" -> kinds.setDefaultRealKind(kind);
                case "doublePrecision" -> kinds.setDoublePrecisionKind(kind);
                case "quadPrecision" -> kinds.setQuadPrecisionKind(kind);
                case "character" -> kinds.setDefaultCharacterKind(kind);
                case "logical" -> kinds.setDefaultLogicalKind(kind);
                default -> throw new FortranCompilerException("Unknown kind option '" + entry.getKey() + "'");
            }
        }
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new FortranCompilerException("Option '" + key + "' must be true or false");
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new FortranCompilerException("Option '" + key + "' must be an integer");
    }

    @Override
    public CompilerOptions clone() {
        try {
            // Shallow copy; defaultKinds is shared
            return (CompilerOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    warningsAsErrors=" + warningsAsErrors + ",\n" +
                "    pruneDoTerminatorLabels=" + pruneDoTerminatorLabels + ",\n" +
                "    fileName='" + fileName + "',\n" +
                "    defaultKinds=" + defaultKinds + "\n" +
                "}";
    }
}

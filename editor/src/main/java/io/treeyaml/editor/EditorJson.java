// file: src/main/java/io/treeyaml/editor/EditorJson.java
package io.treeyaml.editor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.treeyaml.editor.dto.JsonEditorConfig;
import io.treeyaml.editor.dto.TreeView;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Jackson plumbing shared by config loading and the render view.
 * Unknown keys in config files are rejected (Jackson's default).
 */
final class EditorJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private EditorJson() {}

    static JsonEditorConfig readConfig(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), JsonEditorConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load editor config from " + path + ": " + e.getMessage(), e);
        }
    }

    static String write(TreeView view) {
        try {
            return MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render tree view", e);
        }
    }
}

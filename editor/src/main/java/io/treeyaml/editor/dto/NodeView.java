// file: src/main/java/io/treeyaml/editor/dto/NodeView.java
package io.treeyaml.editor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One node of a rendered tree. Children are referenced by id and omitted when absent:
 *   {
 *     "id": "node-2",
 *     "value": 5,
 *     "selected": false,
 *     "leftId": "node-4"
 *   }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeView {
    public String id;
    public int value;
    public boolean selected;
    public String leftId;
    public String rightId;
}

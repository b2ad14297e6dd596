package io.treeyaml.editor.dto;

/**
 * JSON shape of an editor config file. Every key is optional:
 *   {
 *     "rangeMin": 0,
 *     "rangeMax": 100,
 *     "idStrategy": "sequential",
 *     "idPrefix": "node",
 *     "echoCommands": false
 *   }
 */
public class JsonEditorConfig {
    public Integer rangeMin;
    public Integer rangeMax;
    public String idStrategy;       // sequential | random
    public String idPrefix;         // used by sequential ids only
    public Boolean echoCommands;
}

package org.dxworks.adaframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Serializable image of one node. At most one of {@code fields}, {@code items}
 * or {@code text} is set, depending on the node's shape; {@code value} is set
 * for qualifier nodes only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeDump {
    public String kind;
    public String range;
    public Boolean ghost;
    public Boolean value;
    public String text;
    public Map<String, NodeDump> fields;
    public List<NodeDump> items;
}

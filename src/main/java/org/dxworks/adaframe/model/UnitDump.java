package org.dxworks.adaframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitDump {
    public String kind = "unit";
    public String filePath;
    public String language = "ada";
    public boolean parsed;
    public int tokens;
    public List<String> diagnostics = new ArrayList<>();
    public NodeDump root;
}

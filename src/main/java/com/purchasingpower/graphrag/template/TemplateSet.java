package com.purchasingpower.graphrag.template;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One YAML file of named Mustache templates.
 */
@Data
public class TemplateSet {
    private String name;
    private String version;
    private Map<String, String> templates = new LinkedHashMap<>();
}

package com.mainframe.anonymizer.mapping;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mainframe.anonymizer.exception.AnonymizerException;
import com.mainframe.anonymizer.model.IdentifierCategory;
import com.mainframe.anonymizer.overlay.OverlayResolution;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the human-readable mapping report from {@code templates/mapping-report.ftl}.
 */
public class MappingReportRenderer {

    private static final String TEMPLATE = "mapping-report.ftl";

    private final Configuration freemarkerConfig;

    public MappingReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(MappingTable table, List<OverlayResolution> overlays) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("scheme", table.getScheme().name());
        model.put("totalEntries", table.size());
        model.put("categories", categorySections(table));
        model.put("overlays", overlayRows(overlays));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new AnonymizerException("Failed to render mapping report", e);
        }
    }

    private static List<Map<String, Object>> categorySections(MappingTable table) {
        List<Map<String, Object>> sections = new ArrayList<>();
        List<MappingEntry> entries = table.entries();
        for (IdentifierCategory category : IdentifierCategory.values()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            entries.stream()
                    .filter(e -> e.getCategory() == category)
                    .sorted(Comparator.comparing(MappingEntry::getOriginalKey))
                    .forEach(e -> {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("original", e.getOriginalName());
                        row.put("replacement", e.getReplacement());
                        row.put("occurrences", e.getOccurrenceCount());
                        row.put("external", e.isExternallyVisible());
                        row.put("firstSeen", e.getFirstSeen() != null ? e.getFirstSeen().toString() : "-");
                        rows.add(row);
                    });
            if (rows.isEmpty()) {
                continue;
            }
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("name", category.name());
            section.put("prefix", category.getPrefix());
            section.put("rows", rows);
            sections.add(section);
        }
        return sections;
    }

    private static List<Map<String, Object>> overlayRows(List<OverlayResolution> overlays) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (overlays == null) {
            return rows;
        }
        for (OverlayResolution resolution : overlays) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("overlay", resolution.getRelationship().getOverlayName());
            row.put("overlayReplacement", resolution.getOverlayReplacement());
            row.put("target", resolution.getRelationship().getTargetName());
            row.put("targetReplacement", resolution.getTargetReplacement());
            row.put("position", resolution.getPosition());
            row.put("degraded", resolution.isDegraded());
            rows.add(row);
        }
        return rows;
    }
}
